/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.phonepe.contextspace.core.intelligence.action;

import com.phonepe.contextspace.core.errors.ContextSpaceException;
import com.phonepe.contextspace.core.model.ActionExecutionResult;
import com.phonepe.contextspace.core.model.ActionType;
import com.phonepe.contextspace.core.model.ExtractedProblem;
import com.phonepe.contextspace.core.model.RecommendedAction;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;

/**
 * Runs recommended actions through registered handlers. Actions that are not auto executable are only
 * run through {@link #executeApproved(RecommendedAction, ExtractedProblem, String)}.
 */
@Slf4j
public class ActionExecutor {
    public static final String APOLOGY = "We sincerely apologize for the inconvenience. "
            + "We are working to resolve this issue.";

    private final Map<ActionType, ActionHandler> handlers;
    private final Clock clock;

    public ActionExecutor(Map<ActionType, ActionHandler> handlers, Clock clock) {
        this.handlers = handlers.isEmpty() ? new EnumMap<>(ActionType.class) : new EnumMap<>(handlers);
        this.clock = clock;
    }

    /**
     * Executor with the built-in apology and information handlers
     */
    public static ActionExecutor withDefaults(Clock clock) {
        final var handlers = new EnumMap<ActionType, ActionHandler>(ActionType.class);
        handlers.put(ActionType.APOLOGIZE, (action, problem) -> Map.of("message", APOLOGY));
        handlers.put(ActionType.PROVIDE_INFO, (action, problem) -> Map.of("info_type",
                                                                          problem.getCategory().wireName()));
        return new ActionExecutor(handlers, clock);
    }

    public ActionExecutor register(ActionType type, ActionHandler handler) {
        handlers.put(type, handler);
        return this;
    }

    public ActionExecutionResult execute(RecommendedAction action, ExtractedProblem problem) {
        if (!action.isCanAutoExecute()) {
            log.debug("Action {} of type {} needs manual approval", action.getId(), action.getType());
            return result(action, false, "Action requires manual approval", Map.of());
        }
        return run(action, problem);
    }

    /**
     * Runs an action a human has signed off on, regardless of whether it is auto executable
     */
    public ActionExecutionResult executeApproved(RecommendedAction action, ExtractedProblem problem, String approver) {
        log.info("Action {} of type {} approved by {}", action.getId(), action.getType(), approver);
        return run(action, problem);
    }

    private ActionExecutionResult run(RecommendedAction action, ExtractedProblem problem) {
        final var handler = handlers.get(action.getType());
        if (handler == null) {
            return result(action, false, "Action type not supported", Map.of());
        }
        try {
            final var data = handler.handle(action, problem);
            log.debug("Executed action {} of type {}", action.getId(), action.getType());
            return result(action, true, "Action executed", data == null ? Map.of() : data);
        }
        catch (Exception e) {
            log.error("Action {} of type {} failed: {}", action.getId(), action.getType(), e.getMessage(), e);
            return result(action, false, ContextSpaceException.rootMessage(e), Map.of());
        }
    }

    private ActionExecutionResult result(
            RecommendedAction action,
            boolean success,
            String message,
            Map<String, String> data) {
        return ActionExecutionResult.builder()
                .actionId(action.getId())
                .success(success)
                .message(message)
                .executedAt(clock.millis())
                .data(data)
                .build();
    }
}
