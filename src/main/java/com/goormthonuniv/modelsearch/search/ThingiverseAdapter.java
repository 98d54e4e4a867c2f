package com.goormthonuniv.modelsearch.search;

import com.goormthonuniv.modelsearch.config.SearchProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ThingiverseAdapter extends HtmlSourceAdapter {

    public ThingiverseAdapter(PageFetcher fetcher,
                              SearchProperties properties,
                              @Value("${modelsearch.adapters.thingiverse.endpoint:https://www.thingiverse.com/search}") String endpoint,
                              @Value("${modelsearch.adapters.thingiverse.enabled:true}") boolean enabled) {
        super(fetcher, endpoint, enabled, properties.getSearch().getMaxResultsPerSource());
    }

    @Override public Source source() { return Source.THINGIVERSE; }

    @Override protected String queryParam() { return "q"; }

    @Override protected String extraParams() { return "&type=things"; }

    @Override
    protected List<RawListing> extract(Document doc, int limit) {
        List<RawListing> out = new ArrayList<>();
        for (Element card : doc.select("div[class*=ItemCardContainer]")) {
            if (out.size() >= limit) break;

            Element link = card.selectFirst("a[class*=ItemCardContent][href*=/thing:]");
            String url = absAttr(link, "href");
            if (url == null) continue;

            Element titleElem = card.selectFirst("a[class*=ItemCardTitle]");
            if (titleElem == null) titleElem = card.selectFirst("div[class*=ItemCardHeader] a[title]");
            String title = titleElem == null ? null : firstNonBlank(titleElem.attr("title"), titleElem.text());

            Element img = card.selectFirst("img[class*=ItemCardContent]");
            if (img == null) img = card.selectFirst("img");
            String thumb = img == null ? null : firstNonBlank(absAttr(img, "src"), absAttr(img, "data-src"));

            Element authorElem = card.selectFirst("div[class*=ItemCardHeader] a[href*=/]:not([title])");
            String author = authorElem == null ? null : firstNonBlank(authorElem.text());

            // 카드 하단 통계 중 첫 번째가 좋아요
            Integer likes = statAt(statTexts(card), 0);

            out.add(new RawListing(title, url, thumb, author, likes, null));
        }
        return out;
    }
}
