package com.ivamare.rollout.model;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tenant boundary along three dimensions. A null or {@code "*"} dimension in
 * an authorized scope means unrestricted; in a target scope it means the
 * whole of that dimension.
 *
 * @param orgUnit Top-level organizational unit
 * @param businessUnit Business unit within the org unit
 * @param site Physical or logical site
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record TargetScope(
    String orgUnit,
    String businessUnit,
    String site
) {

    public static final String ANY = "*";

    public static TargetScope unrestricted() {
        return new TargetScope(ANY, ANY, ANY);
    }

    /**
     * Dimension values keyed by their names, in boundary order.
     */
    @JsonIgnore
    public Map<String, String> dimensions() {
        Map<String, String> dims = new LinkedHashMap<>();
        dims.put("org_unit", orgUnit);
        dims.put("business_unit", businessUnit);
        dims.put("site", site);
        return dims;
    }

    public static boolean isAny(String value) {
        return value == null || value.isBlank() || ANY.equals(value);
    }
}
