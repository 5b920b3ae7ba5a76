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
import com.phonepe.contextspace.core.model.ExtractedProblem;
import com.phonepe.contextspace.core.model.RecommendedAction;
import com.phonepe.contextspace.core.model.UrgencyLevel;
import com.phonepe.contextspace.core.model.UrgencyScore;
import com.phonepe.contextspace.core.utils.KeywordSet;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.regex.Pattern;

/**
 * Picks candidate actions from a fixed table per problem category
 */
@Slf4j
public class CategoryActionRecommender implements ActionRecommender {
    private static final Pattern ORDER_ID = Pattern.compile("^[A-Z]{2,}\\d+$");
    private static final KeywordSet REFUND = KeywordSet.of("refund");
    private static final KeywordSet PASSWORD = KeywordSet.of("password");

    private final Clock clock;

    public CategoryActionRecommender() {
        this(Clock.systemUTC());
    }

    public CategoryActionRecommender(Clock clock) {
        this.clock = clock;
    }

    @Override
    public List<RecommendedAction> recommend(ExtractedProblem problem, UrgencyScore urgency) {
        final var actions = new ArrayList<RecommendedAction>();
        switch (problem.getCategory()) {
            case DELIVERY -> delivery(problem, urgency, actions);
            case PAYMENT -> payment(problem, urgency, actions);
            case REFUND -> refund(urgency, actions);
            case TECHNICAL -> technical(urgency, actions);
            case ACCOUNT -> account(problem, urgency, actions);
            default -> generic(urgency, actions);
        }
        if (!problem.isCanAgentSolve()) {
            actions.add(action(ActionType.ESCALATE, "Escalate to human supervisor", 1.0, 1.0, false, null));
        }
        actions.sort(Comparator.comparingDouble(RecommendedAction::rankingScore).reversed());
        log.debug("Recommended {} actions for problem {}", actions.size(), problem.getId());
        return List.copyOf(actions);
    }

    private void delivery(ExtractedProblem problem, UrgencyScore urgency, List<RecommendedAction> actions) {
        problem.getEntities()
                .stream()
                .filter(entity -> ORDER_ID.matcher(entity).matches())
                .findFirst()
                .ifPresent(orderId -> actions.add(action(ActionType.CHECK_STATUS,
                                                         "Check delivery status for order " + orderId,
                                                         0.9,
                                                         urgency.getScore(),
                                                         true,
                                                         Map.of("order_id", orderId))));
        if (isSevere(urgency)) {
            actions.add(action(ActionType.OFFER_COMPENSATION, "Offer compensation for delayed delivery",
                               0.7, urgency.getScore() * 0.8, false, null));
        }
    }

    private void payment(ExtractedProblem problem, UrgencyScore urgency, List<RecommendedAction> actions) {
        actions.add(action(ActionType.CHECK_STATUS, "Check payment transaction status",
                           0.8, urgency.getScore(), true, null));
        if (REFUND.anyIn(problem.getDescription())) {
            actions.add(action(ActionType.PROCESS_REFUND, "Process refund request",
                               0.6, urgency.getScore() * 0.9, false, null));
        }
    }

    private void refund(UrgencyScore urgency, List<RecommendedAction> actions) {
        actions.add(action(ActionType.PROCESS_REFUND, "Process refund request",
                           0.7, urgency.getScore(), false, null));
        actions.add(action(ActionType.APOLOGIZE, "Provide apology for inconvenience",
                           0.9, urgency.getScore() * 0.5, true, null));
    }

    private void technical(UrgencyScore urgency, List<RecommendedAction> actions) {
        actions.add(action(ActionType.PROVIDE_INFO, "Provide troubleshooting steps",
                           0.8, urgency.getScore(), true, null));
        if (isSevere(urgency)) {
            actions.add(action(ActionType.ESCALATE, "Escalate to technical support team",
                               0.9, urgency.getScore(), false, null));
        }
    }

    private void account(ExtractedProblem problem, UrgencyScore urgency, List<RecommendedAction> actions) {
        if (PASSWORD.anyIn(problem.getDescription())) {
            actions.add(action(ActionType.UPDATE_ACCOUNT, "Send password reset link",
                               0.95, urgency.getScore(), true, null));
        }
        else {
            actions.add(action(ActionType.UPDATE_ACCOUNT, "Update account information",
                               0.7, urgency.getScore(), false, null));
        }
    }

    private void generic(UrgencyScore urgency, List<RecommendedAction> actions) {
        actions.add(action(ActionType.PROVIDE_INFO, "Provide relevant information",
                           0.6, urgency.getScore() * 0.7, true, null));
        if (isSevere(urgency)) {
            actions.add(action(ActionType.APOLOGIZE, "Provide apology and reassurance",
                               0.8, urgency.getScore() * 0.6, true, null));
        }
    }

    private static boolean isSevere(UrgencyScore urgency) {
        return urgency.getLevel().atLeast(UrgencyLevel.HIGH);
    }

    private RecommendedAction action(
            ActionType type,
            String description,
            double confidence,
            double priority,
            boolean canAutoExecute,
            Map<String, String> params) {
        return RecommendedAction.builder()
                .id("%s-%d-%04x".formatted(type.wireName(), clock.millis(), ThreadLocalRandom.current().nextInt(0x10000)))
                .type(type)
                .description(description)
                .confidence(confidence)
                .priority(priority)
                .canAutoExecute(canAutoExecute)
                .executionParams(params == null ? Map.of() : params)
                .build();
    }
}
