/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.gorgon.workflow;

import java.util.List;

/**
 * Thrown when a template references a variable that is not bound and not marked optional.
 */
public class TemplateResolutionException extends RuntimeException {

    private final List<String> unresolved;

    public TemplateResolutionException(String message, List<String> unresolved) {
        super(message);
        this.unresolved = List.copyOf(unresolved);
    }

    public List<String> getUnresolved() {
        return unresolved;
    }
}
