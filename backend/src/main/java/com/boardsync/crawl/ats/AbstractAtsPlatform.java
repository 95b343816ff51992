package com.boardsync.crawl.ats;

import com.boardsync.crawl.model.JobFields;
import com.boardsync.crawl.util.HtmlText;
import com.boardsync.crawl.util.JobUrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

abstract class AbstractAtsPlatform implements AtsPlatform {

    protected abstract List<String> titleSelectors();

    protected abstract List<String> locationSelectors();

    protected abstract List<String> descriptionSelectors();

    protected List<String> employmentTypeSelectors() {
        return List.of();
    }

    protected List<String> companySelectors() {
        return List.of("meta[property=og:site_name]");
    }

    @Override
    public List<String> collectUrls(Document listing, String listingUrl) {
        URI listingUri = JobUrlUtils.safeUri(listingUrl);
        List<String> urls = new ArrayList<>();
        for (Element anchor : listing.select("a[href]")) {
            String href = JobUrlUtils.resolve(listingUrl, anchor.attr("href"));
            String candidate = href == null ? null : rewriteLink(href);
            URI uri = JobUrlUtils.safeUri(candidate);
            if (uri == null) {
                continue;
            }
            if (isJobLink(uri, listingUri)) {
                urls.add(candidate);
            }
        }
        return urls;
    }

    protected boolean isJobLink(URI link, URI listing) {
        return AtsJobLinks.hostedJobLink(link) != null || AtsJobLinks.isSiteJobLink(link, listing);
    }

    protected String rewriteLink(String href) {
        return href;
    }

    @Override
    public JobFields extractFallbackFields(Document page, String url) {
        Element description = first(page, descriptionSelectors());
        return new JobFields(
            text(page, titleSelectors()),
            text(page, companySelectors()),
            null,
            text(page, locationSelectors()),
            null,
            text(page, employmentTypeSelectors()),
            description == null ? null : HtmlText.fromElement(description),
            null,
            null,
            null,
            null,
            null
        );
    }

    protected Element first(Document page, List<String> selectors) {
        for (String selector : selectors) {
            Element element = page.selectFirst(selector);
            if (element != null && (element.hasText() || element.hasAttr("content"))) {
                return element;
            }
        }
        return null;
    }

    protected String text(Document page, List<String> selectors) {
        Element element = first(page, selectors);
        if (element == null) {
            return null;
        }
        String value = "meta".equals(element.normalName()) ? element.attr("content") : element.text();
        return value == null || value.isBlank() ? null : value.trim();
    }
}
