package com.goormthonuniv.modelsearch.search;

import com.goormthonuniv.modelsearch.config.SearchProperties;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class PrintablesAdapter extends HtmlSourceAdapter {

    public PrintablesAdapter(PageFetcher fetcher,
                             SearchProperties properties,
                             @Value("${modelsearch.adapters.printables.endpoint:https://www.printables.com/search/models}") String endpoint,
                             @Value("${modelsearch.adapters.printables.enabled:true}") boolean enabled) {
        super(fetcher, endpoint, enabled, properties.getSearch().getMaxResultsPerSource());
    }

    @Override public Source source() { return Source.PRINTABLES; }

    @Override protected String queryParam() { return "q"; }

    @Override
    protected List<RawListing> extract(Document doc, int limit) {
        List<RawListing> out = new ArrayList<>();
        for (Element article : doc.select("article[data-testid=model]")) {
            if (out.size() >= limit) break;

            Element link = article.selectFirst("a[href*=/model/]");
            String url = absAttr(link, "href");
            if (url == null) continue;

            Element h5 = article.selectFirst("h5");
            String title = firstNonBlank(h5 == null ? null : h5.text(), link.text());

            // 아바타 링크(이미지만 있음)는 건너뛴다
            String author = null;
            for (Element a : article.select("a[href*=/@]")) {
                author = firstNonBlank(a.text());
                if (author != null) break;
            }

            // 좋아요 / (저장) / 다운로드 순
            List<String> stats = statTexts(article);
            Integer likes = stats.size() >= 2 ? statAt(stats, 0) : null;
            Integer downloads = statAt(stats, 2);

            out.add(new RawListing(title, url, thumbnail(article), author, likes, downloads));
        }
        return out;
    }

    /** 프로필 사진이 아닌 모델 이미지를 고른다 */
    private static String thumbnail(Element article) {
        Element picture = article.selectFirst("picture[class*=image-inside]");
        if (picture != null) {
            Element source = picture.selectFirst("source");
            if (source != null) {
                String srcset = source.attr("srcset");
                String first = srcset.isBlank() ? null : srcset.split(",")[0].strip().split("\\s+")[0];
                String candidate = firstNonBlank(first, absAttr(source, "src"));
                if (candidate != null) return candidate;
            }
            Element img = picture.selectFirst("img");
            if (img != null) {
                String candidate = firstNonBlank(absAttr(img, "src"), absAttr(img, "data-src"));
                if (candidate != null) return candidate;
            }
        }
        for (Element img : article.select("img")) {
            if (img.parents().stream().anyMatch(p -> p.is("a[class*=avatar]"))) continue;
            String candidate = firstNonBlank(absAttr(img, "src"), absAttr(img, "data-src"));
            if (candidate != null) return candidate;
        }
        return null;
    }
}
