package com.geobuffer.model.result;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.geobuffer.model.IndexedPoint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of single point operations
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PointResult {
    
    private IndexedPoint point;
    
    private Boolean found;
    
    private Integer deleted;
}
