package com.delta.leadgen.leads.service;

import com.delta.leadgen.leads.model.CompanyLead;
import com.delta.leadgen.leads.model.JobStatus;
import com.delta.leadgen.leads.model.LeadBatch;
import com.delta.leadgen.leads.model.LeadExport;
import com.delta.leadgen.leads.model.LeadJob;
import com.delta.leadgen.leads.model.SocialMediaLinks;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Builds export representations from completed jobs. Anything other than a COMPLETED job is rejected.
 */
@Component
public class LeadResultProjector {
    static final String[] CSV_HEADERS = {
        "company_name",
        "website_url",
        "company_size",
        "headquarters_location",
        "revenue_market_cap",
        "key_products_services",
        "target_market",
        "number_of_users",
        "notable_customers",
        "contact_email",
        "additional_emails",
        "linkedin",
        "twitter",
        "facebook",
        "instagram",
        "youtube",
        "recent_news_insights",
        "decision_maker_roles"
    };

    public LeadExport toExport(LeadJob job) {
        LeadBatch result = completedResult(job);
        return new LeadExport(job.id(), result.size(), result.companies());
    }

    public String toCsv(LeadJob job) {
        LeadBatch result = completedResult(job);
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader(CSV_HEADERS)
            .build();
        StringWriter out = new StringWriter();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (CompanyLead company : result.companies()) {
                SocialMediaLinks social = preferredSocial(company);
                printer.printRecord(
                    company.companyName(),
                    company.websiteUrl(),
                    company.companySize(),
                    company.headquartersLocation(),
                    company.revenueMarketCap(),
                    company.keyProductsServices(),
                    company.targetMarket(),
                    company.numberOfUsers(),
                    joined(company.notableCustomers()),
                    company.contactEmail(),
                    joined(company.additionalEmails()),
                    social.linkedin(),
                    social.twitter(),
                    social.facebook(),
                    social.instagram(),
                    social.youtube(),
                    company.recentNewsInsights(),
                    joined(company.decisionMakerRoles())
                );
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write CSV export for job " + job.id(), e);
        }
        return out.toString();
    }

    private LeadBatch completedResult(LeadJob job) {
        if (job.status() != JobStatus.COMPLETED) {
            throw new JobNotTerminalException(job.id(), job.status());
        }
        if (job.result() == null) {
            throw new IllegalStateException("Completed job " + job.id() + " has no result");
        }
        return job.result();
    }

    // Scraped links win per platform; the generated ones fill the gaps.
    private SocialMediaLinks preferredSocial(CompanyLead company) {
        SocialMediaLinks scraped = company.socialMediaScraped() == null ? SocialMediaLinks.empty() : company.socialMediaScraped();
        SocialMediaLinks generated = company.socialMedia() == null ? SocialMediaLinks.empty() : company.socialMedia();
        return new SocialMediaLinks(
            scraped.linkedin() != null ? scraped.linkedin() : generated.linkedin(),
            scraped.twitter() != null ? scraped.twitter() : generated.twitter(),
            scraped.facebook() != null ? scraped.facebook() : generated.facebook(),
            scraped.instagram() != null ? scraped.instagram() : generated.instagram(),
            scraped.youtube() != null ? scraped.youtube() : generated.youtube()
        );
    }

    private String joined(List<String> values) {
        return values == null || values.isEmpty() ? null : String.join("; ", values);
    }
}
