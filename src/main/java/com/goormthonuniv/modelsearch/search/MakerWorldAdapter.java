package com.goormthonuniv.modelsearch.search;

import com.goormthonuniv.modelsearch.config.SearchProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

@Component
public class MakerWorldAdapter extends HtmlSourceAdapter {

    private static final Pattern MODEL_PATH = Pattern.compile("/models/\\d+");

    public MakerWorldAdapter(PageFetcher fetcher,
                             SearchProperties properties,
                             @Value("${modelsearch.adapters.makerworld.endpoint:https://makerworld.com/en/search/models}") String endpoint,
                             @Value("${modelsearch.adapters.makerworld.enabled:true}") boolean enabled) {
        super(fetcher, endpoint, enabled, properties.getSearch().getMaxResultsPerSource());
    }

    @Override public Source source() { return Source.MAKERWORLD; }

    @Override protected String queryParam() { return "keyword"; }

    @Override
    protected List<RawListing> extract(Document doc, int limit) {
        List<RawListing> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element link : doc.select("a[href*=/models/]")) {
            if (out.size() >= limit) break;

            String href = link.attr("href");
            if (!MODEL_PATH.matcher(href).find() || !seen.add(href)) continue;
            String url = absAttr(link, "href");

            Element img = link.selectFirst("img");
            Element h3 = link.selectFirst("h3");
            String title = firstNonBlank(
                    img == null ? null : img.attr("alt"),
                    h3 == null ? null : h3.text(),
                    link.attr("title"),
                    link.text());
            String thumb = img == null ? null : firstNonBlank(absAttr(img, "src"), absAttr(img, "data-src"));

            Element card = enclosingCard(link);
            String author = null;
            if (card != null) {
                Element authorElem = card.selectFirst("[class*=author], [class*=creator]");
                if (authorElem != null) author = firstNonBlank(authorElem.text());
            }

            // 프린트 / 좋아요 / 다운로드 순
            List<String> stats = statTexts(card != null ? card : link.parent());
            out.add(new RawListing(title, url, thumb, author, statAt(stats, 1), statAt(stats, 2)));
        }
        return out;
    }

    private static Element enclosingCard(Element link) {
        for (Element p : link.parents()) {
            if (p.className().contains("card")) return p;
        }
        return null;
    }
}
