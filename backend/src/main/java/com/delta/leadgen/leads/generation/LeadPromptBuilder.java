package com.delta.leadgen.leads.generation;

import com.delta.leadgen.leads.model.LeadRequest;

final class LeadPromptBuilder {
    private static final String RECORD_SHAPE = """
        {
          "companies": [
            {
              "company_name": "Official company name",
              "website_url": "Official website URL",
              "company_size": "Approximate employee range",
              "headquarters_location": "City and country",
              "revenue_market_cap": "Annual revenue or market capitalisation",
              "key_products_services": "Main offerings relevant to the industry",
              "target_market": "Primary customer segments",
              "number_of_users": "Users, members, customers or subscribers served",
              "notable_customers": ["Customer 1", "Customer 2"],
              "social_media": {
                "linkedin": "LinkedIn page URL",
                "twitter": "Twitter/X profile URL",
                "facebook": "Facebook page URL",
                "instagram": "Instagram profile URL",
                "youtube": "YouTube channel URL"
              },
              "contact_email": "General contact email",
              "recent_news_insights": "Recent developments or partnerships",
              "decision_maker_roles": ["CEO", "CFO", "VP of Sales"]
            }
          ]
        }
        """;

    private LeadPromptBuilder() {}

    static String build(LeadRequest request) {
        return "You are a lead generation researcher. List " + request.count()
            + " companies in the " + request.industry()
            + " industry that are based in or operate in " + request.country() + ".\n\n"
            + "Respond with a single JSON object and nothing else: no markdown, no code fences, no commentary. "
            + "Use exactly this structure:\n"
            + RECORD_SHAPE
            + "\nWhen a value is not publicly known, use JSON null rather than a placeholder string. "
            + "This applies to individual social media platforms as well. "
            + "For number_of_users give the most recent approximate figure, for example \"2.5 million customers\". "
            + "Social media values must be full URLs.";
    }
}
