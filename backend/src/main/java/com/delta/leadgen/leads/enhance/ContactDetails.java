package com.delta.leadgen.leads.enhance;

import com.delta.leadgen.leads.model.SocialMediaLinks;

import java.util.List;

public record ContactDetails(List<String> emails, SocialMediaLinks socialMedia) {

    public ContactDetails {
        emails = emails == null ? List.of() : List.copyOf(emails);
        socialMedia = socialMedia == null ? SocialMediaLinks.empty() : socialMedia;
    }

    public boolean isEmpty() {
        return emails.isEmpty() && socialMedia.isEmpty();
    }
}
