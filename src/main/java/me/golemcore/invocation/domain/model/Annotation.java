package me.golemcore.invocation.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Citation attached to a text span.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Annotation {

    private String title;
    private String url;
    private String fileId;
    private String snippet;
    private Integer startIndex;
    private Integer endIndex;
}
