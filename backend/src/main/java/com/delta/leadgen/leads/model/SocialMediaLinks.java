package com.delta.leadgen.leads.model;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record SocialMediaLinks(
    String linkedin,
    String twitter,
    String facebook,
    String instagram,
    String youtube
) {
    public static SocialMediaLinks empty() {
        return new SocialMediaLinks(null, null, null, null, null);
    }

    public boolean isEmpty() {
        return linkedin == null && twitter == null && facebook == null && instagram == null && youtube == null;
    }
}
