package fun.fengwk.mfr.core.service.extract.parser;

import fun.fengwk.mfr.core.service.extract.support.MarkupTexts;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects inline tag markers from a post body.
 *
 * @author fengwk
 */
@Component
public class TagCollector {

    private static final String TAG_SELECTOR = "span[class=tag], a[class*=tag]";

    public List<String> collect(Element root) {
        List<String> tags = new ArrayList<>();
        if (root == null) {
            return tags;
        }
        for (Element element : root.select(TAG_SELECTOR)) {
            String tag = MarkupTexts.trim(MarkupTexts.leadingText(element));
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

}
