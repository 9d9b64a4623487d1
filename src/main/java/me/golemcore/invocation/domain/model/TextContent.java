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

import java.util.ArrayList;
import java.util.List;

/**
 * Plain text produced by the model or supplied by the user.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class TextContent implements Content {

    public static final String TYPE = "text";

    private String text;
    private List<Annotation> annotations;
    private Object rawRepresentation;

    public static TextContent of(String text) {
        return TextContent.builder().text(text).build();
    }

    @Override
    public String getType() {
        return TYPE;
    }

    /**
     * Joins this text with the next one. Annotations are concatenated and raw
     * representations are flattened into a single list.
     */
    public TextContent concat(TextContent other) {
        return TextContent.builder()
                .text(nullToEmpty(text) + nullToEmpty(other.getText()))
                .annotations(mergeAnnotations(annotations, other.getAnnotations()))
                .rawRepresentation(mergeRaw(rawRepresentation, other.getRawRepresentation()))
                .build();
    }

    static String nullToEmpty(String value) {
        return value != null ? value : "";
    }

    static List<Annotation> mergeAnnotations(List<Annotation> left, List<Annotation> right) {
        if (left == null && right == null) {
            return null;
        }
        List<Annotation> merged = new ArrayList<>();
        if (left != null) {
            merged.addAll(left);
        }
        if (right != null) {
            merged.addAll(right);
        }
        return merged;
    }

    static Object mergeRaw(Object left, Object right) {
        if (left == null) {
            return right;
        }
        if (right == null) {
            return left;
        }
        List<Object> merged = new ArrayList<>();
        appendRaw(merged, left);
        appendRaw(merged, right);
        return merged;
    }

    private static void appendRaw(List<Object> target, Object raw) {
        if (raw instanceof List<?> list) {
            target.addAll(list);
        } else {
            target.add(raw);
        }
    }
}
