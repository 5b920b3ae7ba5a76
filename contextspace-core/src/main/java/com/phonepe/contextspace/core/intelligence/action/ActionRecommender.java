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

import com.phonepe.contextspace.core.model.ExtractedProblem;
import com.phonepe.contextspace.core.model.RecommendedAction;
import com.phonepe.contextspace.core.model.UrgencyScore;

import java.util.List;

/**
 * Suggests actions for a problem, best first
 */
public interface ActionRecommender {
    List<RecommendedAction> recommend(ExtractedProblem problem, UrgencyScore urgency);
}
