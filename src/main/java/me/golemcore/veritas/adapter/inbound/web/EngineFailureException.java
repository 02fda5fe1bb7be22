package me.golemcore.veritas.adapter.inbound.web;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.veritas.domain.model.EngineResult;
import me.golemcore.veritas.domain.model.FailureKind;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Carries a failed {@link EngineResult} out of a controller so that
 * {@link GlobalExceptionHandler} can render it.
 */
@Getter
public class EngineFailureException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final FailureKind kind;

    public EngineFailureException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Payload of a successful result, or throws for a failed one.
     */
    public static <T> T unwrap(EngineResult<T> result) {
        if (result.isFailure()) {
            throw new EngineFailureException(result.getFailureKind(), result.getMessage());
        }
        return result.getValue();
    }

    public HttpStatus httpStatus() {
        if (kind == null) {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
        return switch (kind) {
        case VALIDATION, PARSE -> HttpStatus.BAD_REQUEST;
        case PROVIDER -> HttpStatus.BAD_GATEWAY;
        case STORE, INTERNAL -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
