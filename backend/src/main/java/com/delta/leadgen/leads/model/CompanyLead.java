package com.delta.leadgen.leads.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One company record as returned by the generation service, optionally augmented by the website scraper.
 * Field names on the wire are snake_case to match the model prompt.
 */
public record CompanyLead(
    @JsonProperty("company_name") String companyName,
    @JsonProperty("website_url") String websiteUrl,
    @JsonProperty("company_size") String companySize,
    @JsonProperty("headquarters_location") String headquartersLocation,
    @JsonProperty("revenue_market_cap") String revenueMarketCap,
    @JsonProperty("key_products_services") String keyProductsServices,
    @JsonProperty("target_market") String targetMarket,
    @JsonProperty("number_of_users") String numberOfUsers,
    @JsonProperty("notable_customers") List<String> notableCustomers,
    @JsonProperty("social_media") SocialMediaLinks socialMedia,
    @JsonProperty("social_media_scraped") SocialMediaLinks socialMediaScraped,
    @JsonProperty("contact_email") String contactEmail,
    @JsonProperty("contact_email_llm") String contactEmailLlm,
    @JsonProperty("additional_emails") List<String> additionalEmails,
    @JsonProperty("recent_news_insights") String recentNewsInsights,
    @JsonProperty("decision_maker_roles") List<String> decisionMakerRoles
) {
    public static CompanyLead named(String companyName, String websiteUrl) {
        return new CompanyLead(
            companyName,
            websiteUrl,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null,
            null
        );
    }

    /**
     * Merge scraped contact data. The model-provided email is kept as {@code contact_email_llm}; a scraped
     * email, when present, takes over {@code contact_email}.
     */
    public CompanyLead withScrapedContacts(List<String> scrapedEmails, SocialMediaLinks scrapedSocial) {
        List<String> emails = scrapedEmails == null ? List.of() : scrapedEmails;
        String primary = emails.isEmpty() ? contactEmail : emails.get(0);
        List<String> additional = emails.size() > 1 ? List.copyOf(emails.subList(1, emails.size())) : additionalEmails;
        SocialMediaLinks social = scrapedSocial == null || scrapedSocial.isEmpty() ? socialMediaScraped : scrapedSocial;
        return new CompanyLead(
            companyName,
            websiteUrl,
            companySize,
            headquartersLocation,
            revenueMarketCap,
            keyProductsServices,
            targetMarket,
            numberOfUsers,
            notableCustomers,
            socialMedia,
            social,
            primary,
            contactEmail,
            additional,
            recentNewsInsights,
            decisionMakerRoles
        );
    }
}
