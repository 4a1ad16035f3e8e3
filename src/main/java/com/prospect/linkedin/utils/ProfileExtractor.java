package com.prospect.linkedin.utils;

import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.prospect.linkedin.config.ScraperConfig;
import com.prospect.linkedin.model.ProfileCertification;
import com.prospect.linkedin.model.ProfileEducation;
import com.prospect.linkedin.model.ProfileExperience;
import com.prospect.linkedin.model.ScrapedProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Pulls the top-card fields and the experience, education and certification lists out of a rendered
 * LinkedIn profile. Each top-card field has a selector chain, tried in order until one yields non-blank text.
 */
@Slf4j
@Component
public class ProfileExtractor {

    public static final String UNKNOWN_NAME = "Unknown";
    static final int MAX_EXPERIENCE = 3;

    static final String HEADER_SELECTOR = "h1.text-heading-xlarge, h1.top-card-layout__title";

    static final List<String> SECTION_ANCHORS = Arrays.asList(
            "#about", "#experience", "#education", "#licenses_and_certifications");

    static final String EXPERIENCE_ITEMS = "section:has(#experience) ul > li.artdeco-list__item";
    static final String EDUCATION_ITEMS = "section:has(#education) ul > li.artdeco-list__item";
    static final String CERTIFICATION_ITEMS = "section:has(#licenses_and_certifications) ul > li.artdeco-list__item";

    static final String ITEM_PRIMARY = "span[aria-hidden='true']";
    static final String ITEM_SECONDARY = "span.t-14.t-normal:not(.t-black--light) span[aria-hidden='true']";
    static final String ITEM_META = "span.t-14.t-normal.t-black--light span[aria-hidden='true']";
    static final String ITEM_DESCRIPTION = "div.display-flex span[aria-hidden='true']";
    static final String ITEM_CREDENTIAL_LINK = "a[href*='credential']";

    private final ScraperConfig scraperConfig;

    public ProfileExtractor(ScraperConfig scraperConfig) {
        this.scraperConfig = scraperConfig;
    }

    static final List<String> NAME_SELECTORS = Arrays.asList(
            "h1.text-heading-xlarge",
            "h1.top-card-layout__title",
            "main section h1"
    );

    static final List<String> HEADLINE_SELECTORS = Arrays.asList(
            "div.text-body-medium.break-words",
            "div.text-body-medium",
            "div.top-card-layout__headline",
            "h2.top-card-layout__headline"
    );

    static final List<String> LOCATION_SELECTORS = Arrays.asList(
            "span.text-body-small.inline.t-black--light.break-words",
            "div.top-card__subline-item:nth-child(1)",
            "div.pv-text-details__left-panel span.text-body-small"
    );

    static final List<String> COMPANY_SELECTORS = Arrays.asList(
            "button[aria-label^='Current company'] span",
            "section:has(#experience) li span.t-14.t-normal span[aria-hidden='true']",
            "div.top-card-layout__first-subline a"
    );

    static final List<String> BIO_SELECTORS = Arrays.asList(
            "section:has(#about) div.display-flex span[aria-hidden='true']",
            "section.summary p",
            "div.core-section-container__content p"
    );

    /**
     * Block until the top card and the lazy-loaded sections are attached. Sections that never show
     * up are normal (empty profiles), so timeouts are logged and ignored.
     */
    public void waitForProfileSections(Page page) {
        try {
            page.waitForSelector(HEADER_SELECTOR, new Page.WaitForSelectorOptions()
                    .setState(WaitForSelectorState.ATTACHED)
                    .setTimeout(scraperConfig.getProfileHeaderTimeoutMs()));
        } catch (PlaywrightException e) {
            log.warn("Profile header did not render: {}", e.getMessage());
        }

        List<String> loaded = new ArrayList<>();
        for (String anchor : SECTION_ANCHORS) {
            try {
                page.waitForSelector(anchor, new Page.WaitForSelectorOptions()
                        .setState(WaitForSelectorState.ATTACHED)
                        .setTimeout(scraperConfig.getSectionTimeoutMs()));
                loaded.add(anchor);
            } catch (PlaywrightException e) {
                log.debug("Section {} not present: {}", anchor, e.getMessage());
            }
        }
        log.debug("Profile sections loaded: {}", loaded);
    }

    /**
     * Page must already be on the profile. Never throws for missing fields; they are reported in
     * {@link ScrapedProfile#getMissingFields()}.
     */
    public ScrapedProfile extract(Page page, String profileUrl, Instant scrapedAt) {
        String name = firstText(page, NAME_SELECTORS);
        String headline = firstText(page, HEADLINE_SELECTORS);
        String location = firstText(page, LOCATION_SELECTORS);
        String company = cleanCompany(firstText(page, COMPANY_SELECTORS));
        String bio = firstText(page, BIO_SELECTORS);

        if (company.isEmpty()) {
            company = companyFromHeadline(headline);
        }

        List<String> missing = new ArrayList<>();
        if (name.isEmpty()) missing.add("name");
        if (headline.isEmpty()) missing.add("title");
        if (company.isEmpty()) missing.add("company");
        if (location.isEmpty()) missing.add("location");
        if (bio.isEmpty()) missing.add("bio");

        if (!missing.isEmpty()) {
            log.debug("Profile {} missing fields {}", profileUrl, missing);
        }

        return ScrapedProfile.builder()
                .name(name.isEmpty() ? UNKNOWN_NAME : name)
                .title(headline)
                .company(company)
                .location(location)
                .bio(bio)
                .experience(extractExperience(page))
                .education(extractEducation(page))
                .certifications(extractCertifications(page))
                .profileUrl(profileUrl)
                .platform(ScraperConfig.PLATFORM)
                .scrapedAt(scrapedAt)
                .missingFields(missing)
                .needsManualReview(name.isEmpty() || missing.size() >= 3)
                .build();
    }

    /**
     * Most recent roles first, at most {@value #MAX_EXPERIENCE}.
     */
    List<ProfileExperience> extractExperience(Page page) {
        List<ProfileExperience> result = new ArrayList<>();
        for (Locator item : items(page, EXPERIENCE_ITEMS, MAX_EXPERIENCE)) {
            String title = textIn(item, ITEM_PRIMARY);
            if (title.isEmpty()) {
                continue;
            }
            // "Jan 2020 - Present · 3 yrs 2 mos"
            String[] dates = splitOnce(textIn(item, ITEM_META), " · ");
            String[] range = splitOnce(dates[0], " - ");
            result.add(ProfileExperience.builder()
                    .title(title)
                    .company(cleanCompany(textIn(item, ITEM_SECONDARY)))
                    .startDate(range[0])
                    .endDate(range[1])
                    .duration(dates[1])
                    .location(nthText(item, ITEM_META, 1))
                    .description(textIn(item, ITEM_DESCRIPTION))
                    .build());
        }
        return result;
    }

    List<ProfileEducation> extractEducation(Page page) {
        List<ProfileEducation> result = new ArrayList<>();
        for (Locator item : items(page, EDUCATION_ITEMS, Integer.MAX_VALUE)) {
            String school = textIn(item, ITEM_PRIMARY);
            if (school.isEmpty()) {
                continue;
            }
            String[] degree = splitDegree(textIn(item, ITEM_SECONDARY));
            String[] years = splitOnce(textIn(item, ITEM_META), " - ");
            result.add(ProfileEducation.builder()
                    .school(school)
                    .degree(degree[0])
                    .field(degree[1])
                    .startYear(years[0])
                    .endYear(years[1])
                    .build());
        }
        return result;
    }

    List<ProfileCertification> extractCertifications(Page page) {
        List<ProfileCertification> result = new ArrayList<>();
        for (Locator item : items(page, CERTIFICATION_ITEMS, Integer.MAX_VALUE)) {
            String name = textIn(item, ITEM_PRIMARY);
            if (name.isEmpty()) {
                continue;
            }
            ProfileCertification.ProfileCertificationBuilder cert = ProfileCertification.builder()
                    .name(name)
                    .issuer(textIn(item, ITEM_SECONDARY))
                    .issueDate("")
                    .expirationDate("")
                    .credentialUrl(attributeIn(item, ITEM_CREDENTIAL_LINK, "href"));
            for (String meta : allText(item, ITEM_META)) {
                if (meta.startsWith("Issued ")) {
                    cert.issueDate(meta.substring("Issued ".length()).trim());
                } else if (meta.startsWith("Expires ")) {
                    cert.expirationDate(meta.substring("Expires ".length()).trim());
                }
            }
            result.add(cert.build());
        }
        return result;
    }

    /**
     * "Bachelor of Science - BS, Computer Science" gives degree and field split on the first comma,
     * falling back to " - ". Text without either is all degree.
     */
    static String[] splitDegree(String text) {
        int comma = text.indexOf(',');
        if (comma >= 0) {
            return new String[]{text.substring(0, comma).trim(), text.substring(comma + 1).trim()};
        }
        return splitOnce(text, " - ");
    }

    static String[] splitOnce(String text, String separator) {
        int idx = text.indexOf(separator);
        if (idx < 0) {
            return new String[]{text.trim(), ""};
        }
        return new String[]{text.substring(0, idx).trim(), text.substring(idx + separator.length()).trim()};
    }

    /**
     * "Staff Engineer at Acme Corp" gives "Acme Corp". Headlines without " at " give "".
     */
    static String companyFromHeadline(String headline) {
        if (headline == null) {
            return "";
        }
        int idx = headline.lastIndexOf(" at ");
        return idx < 0 ? "" : headline.substring(idx + 4).trim();
    }

    // "Acme Corp · Full-time"
    static String cleanCompany(String raw) {
        int dot = raw.indexOf(" · ");
        return dot < 0 ? raw : raw.substring(0, dot).trim();
    }

    static String firstText(Page page, List<String> selectors) {
        for (String selector : selectors) {
            try {
                Locator locator = page.locator(selector);
                if (locator.count() == 0) {
                    continue;
                }
                String text = normalize(locator.first().innerText());
                if (!text.isEmpty()) {
                    return text;
                }
            } catch (PlaywrightException e) {
                log.debug("Selector {} failed: {}", selector, e.getMessage());
            }
        }
        return "";
    }

    private static List<Locator> items(Page page, String selector, int limit) {
        List<Locator> result = new ArrayList<>();
        try {
            Locator all = page.locator(selector);
            int count = Math.min(all.count(), limit);
            for (int i = 0; i < count; i++) {
                result.add(all.nth(i));
            }
        } catch (PlaywrightException e) {
            log.debug("List {} failed: {}", selector, e.getMessage());
        }
        return result;
    }

    private static String textIn(Locator item, String selector) {
        return nthText(item, selector, 0);
    }

    private static String nthText(Locator item, String selector, int index) {
        try {
            Locator found = item.locator(selector);
            if (found.count() <= index) {
                return "";
            }
            return normalize(found.nth(index).innerText());
        } catch (PlaywrightException e) {
            log.debug("Item selector {} failed: {}", selector, e.getMessage());
            return "";
        }
    }

    private static List<String> allText(Locator item, String selector) {
        try {
            List<String> texts = new ArrayList<>();
            for (String text : item.locator(selector).allInnerTexts()) {
                texts.add(normalize(text));
            }
            return texts;
        } catch (PlaywrightException e) {
            log.debug("Item selector {} failed: {}", selector, e.getMessage());
            return List.of();
        }
    }

    private static String attributeIn(Locator item, String selector, String attribute) {
        try {
            Locator found = item.locator(selector);
            if (found.count() == 0) {
                return "";
            }
            String value = found.first().getAttribute(attribute);
            return value != null ? value : "";
        } catch (PlaywrightException e) {
            log.debug("Item selector {} failed: {}", selector, e.getMessage());
            return "";
        }
    }

    private static String normalize(String text) {
        return text == null ? "" : text.replaceAll("\\s+", " ").trim();
    }
}
