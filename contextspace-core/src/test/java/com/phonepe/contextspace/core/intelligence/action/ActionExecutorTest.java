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

import com.phonepe.contextspace.core.model.ActionType;
import com.phonepe.contextspace.core.model.ProblemCategory;
import com.phonepe.contextspace.core.model.RecommendedAction;
import com.phonepe.contextspace.core.utils.TestUtils;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.phonepe.contextspace.core.intelligence.IntelligenceTestSupport.problem;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ActionExecutorTest {
    private final ActionExecutor executor = ActionExecutor.withDefaults(new TestUtils.TickingClock(5_000L));

    private static RecommendedAction action(ActionType type, boolean auto) {
        return RecommendedAction.builder()
                .id(type.wireName() + "-1")
                .type(type)
                .description("test")
                .confidence(0.5)
                .priority(0.5)
                .canAutoExecute(auto)
                .executionParams(Map.of())
                .build();
    }

    @Test
    void testBuiltInHandlers() {
        final var problem = problem(ProblemCategory.DELIVERY, "late", 0.5, true, 0.5);
        final var apology = executor.execute(action(ActionType.APOLOGIZE, true), problem);
        assertTrue(apology.isSuccess());
        assertEquals(Map.of("message", ActionExecutor.APOLOGY), apology.getData());
        assertEquals("apologize-1", apology.getActionId());

        final var info = executor.execute(action(ActionType.PROVIDE_INFO, true), problem);
        assertEquals(Map.of("info_type", "delivery"), info.getData());
    }

    @Test
    void testManualActionsNeedApproval() {
        final var problem = problem(ProblemCategory.REFUND, "refund", 0.5, true, 0.5);
        final var refused = executor.execute(action(ActionType.APOLOGIZE, false), problem);
        assertFalse(refused.isSuccess());
        assertEquals("Action requires manual approval", refused.getMessage());

        final var approved = executor.executeApproved(action(ActionType.APOLOGIZE, false), problem, "agent-1");
        assertTrue(approved.isSuccess());
    }

    @Test
    void testUnsupportedAndFailingHandlers() {
        final var problem = problem(ProblemCategory.REFUND, "refund", 0.5, true, 0.5);
        final var unsupported = executor.execute(action(ActionType.CANCEL_ORDER, true), problem);
        assertFalse(unsupported.isSuccess());
        assertEquals("Action type not supported", unsupported.getMessage());

        executor.register(ActionType.PROCESS_REFUND, (action, p) -> {
            throw new IllegalStateException("payment gateway down");
        });
        final var failed = executor.executeApproved(action(ActionType.PROCESS_REFUND, false), problem, "agent-1");
        assertFalse(failed.isSuccess());
        assertEquals("payment gateway down", failed.getMessage());

        executor.register(ActionType.CHECK_STATUS, (action, p) -> Map.of("status", "in_transit"));
        assertEquals(Map.of("status", "in_transit"),
                     executor.execute(action(ActionType.CHECK_STATUS, true), problem).getData());
    }
}
