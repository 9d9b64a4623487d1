package me.golemcore.invocation.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Token counts reported by the model service. Counts are nullable because
 * providers do not always report every figure.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UsageDetails {

    private Integer inputTokenCount;
    private Integer outputTokenCount;
    private Integer totalTokenCount;
    private Map<String, Integer> additionalCounts;

    /**
     * Creates a usage record with input and output counts and their total.
     */
    public static UsageDetails of(int inputTokens, int outputTokens) {
        return UsageDetails.builder()
                .inputTokenCount(inputTokens)
                .outputTokenCount(outputTokens)
                .totalTokenCount(inputTokens + outputTokens)
                .build();
    }

    /**
     * Returns a new record with every count summed. A count missing on both sides
     * stays {@code null}; additional counts are merged by key.
     */
    public UsageDetails add(UsageDetails other) {
        if (other == null) {
            return copy();
        }
        return UsageDetails.builder()
                .inputTokenCount(sum(inputTokenCount, other.getInputTokenCount()))
                .outputTokenCount(sum(outputTokenCount, other.getOutputTokenCount()))
                .totalTokenCount(sum(totalTokenCount, other.getTotalTokenCount()))
                .additionalCounts(mergeCounts(additionalCounts, other.getAdditionalCounts()))
                .build();
    }

    public static UsageDetails add(UsageDetails left, UsageDetails right) {
        if (left == null) {
            return right != null ? right.copy() : null;
        }
        return left.add(right);
    }

    private UsageDetails copy() {
        return UsageDetails.builder()
                .inputTokenCount(inputTokenCount)
                .outputTokenCount(outputTokenCount)
                .totalTokenCount(totalTokenCount)
                .additionalCounts(additionalCounts != null ? new LinkedHashMap<>(additionalCounts) : null)
                .build();
    }

    private static Integer sum(Integer left, Integer right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        return left + right;
    }

    private static Map<String, Integer> mergeCounts(Map<String, Integer> left, Map<String, Integer> right) {
        if (left == null && right == null) {
            return null;
        }
        Map<String, Integer> merged = new LinkedHashMap<>();
        if (left != null) {
            merged.putAll(left);
        }
        if (right != null) {
            right.forEach((key, value) -> merged.merge(key, value, UsageDetails::sum));
        }
        return merged;
    }
}
