package fun.fengwk.mfr.core.service.extract.impl;

import lombok.Getter;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one extraction call.
 *
 * @author fengwk
 */
@Getter
public class ExtractionContext {

    private final String baseUrl;
    private final List<String> fragments = new ArrayList<>();
    private final List<String> images = new ArrayList<>();

    /**
     * Armed after a storefront widget, consumed by the first matching caption span.
     */
    @Setter
    private boolean suppressTrailer;

    private int depth;

    public ExtractionContext(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public void emit(String fragment) {
        if (fragment != null && !fragment.isEmpty()) {
            fragments.add(fragment);
        }
    }

    public void addImage(String imageUrl) {
        images.add(imageUrl);
    }

    public void enter() {
        depth++;
    }

    public void exit() {
        depth--;
    }

}
