package fun.fengwk.mfr.core.service.forum.impl;

/**
 * Decoded forum page.
 *
 * @param statusCode http status
 * @param finalUrl   url after redirects
 * @param body       decoded body
 * @author fengwk
 */
public record ForumResponse(int statusCode, String finalUrl, String body) {

    public boolean isOk() {
        return statusCode == 200;
    }

}
