package fun.fengwk.mfr.core.service.extract;

import fun.fengwk.mfr.core.service.extract.model.ExtractionResult;
import org.jsoup.nodes.Element;

/**
 * Extracts the annotated text, images and tags of one post body.
 *
 * @author fengwk
 */
public interface PostContentExtractor {

    /**
     * Walks the message body node. Never throws, a body that cannot be walked
     * yields {@link ExtractionResult#failed()}.
     *
     * @param root    message body node
     * @param baseUrl forum base url used to resolve relative references
     * @return extraction result
     */
    ExtractionResult extract(Element root, String baseUrl);

    /**
     * Parses an html fragment holding one message body and extracts it.
     */
    ExtractionResult extract(String bodyHtml, String baseUrl);

}
