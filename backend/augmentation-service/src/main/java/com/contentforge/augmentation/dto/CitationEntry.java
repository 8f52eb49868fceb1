package com.contentforge.augmentation.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One bibliography line, shared by every claim citing the same source key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CitationEntry {

    /** Citation number, dense from 1 */
    private int id;

    /** Source key (URL or label) */
    private String source;

    /** Style-formatted reference text */
    private String formatted;

    /** Source URL; null for label sources */
    private String url;

    /** Access date (yyyy-MM-dd) */
    private String accessed;

    /** apa | mla | chicago */
    private String style;
}
