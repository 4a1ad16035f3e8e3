package com.prospect.linkedin.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.SameSiteAttribute;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;
import java.util.Optional;

/**
 * Browser cookie in the shape we persist. Conversion from Playwright drops anything without a name, value or domain.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionCookie {
    private String name;
    private String value;
    private String domain;
    private String path;
    private Double expires;
    private Boolean httpOnly;
    private Boolean secure;
    private String sameSite;

    public static Optional<SessionCookie> fromPlaywright(Cookie cookie) {
        if (cookie == null || isBlank(cookie.name) || cookie.value == null || isBlank(cookie.domain)) {
            return Optional.empty();
        }
        return Optional.of(SessionCookie.builder()
                .name(cookie.name)
                .value(cookie.value)
                .domain(cookie.domain)
                .path(cookie.path != null ? cookie.path : "/")
                .expires(cookie.expires)
                .httpOnly(cookie.httpOnly)
                .secure(cookie.secure)
                .sameSite(cookie.sameSite != null ? cookie.sameSite.name() : null)
                .build());
    }

    public Cookie toPlaywright() {
        Cookie cookie = new Cookie(name, value)
                .setDomain(domain)
                .setPath(path != null ? path : "/");
        if (expires != null) {
            cookie.setExpires(expires);
        }
        if (httpOnly != null) {
            cookie.setHttpOnly(httpOnly);
        }
        if (secure != null) {
            cookie.setSecure(secure);
        }
        if (sameSite != null) {
            cookie.setSameSite(SameSiteAttribute.valueOf(sameSite.toUpperCase(Locale.ROOT)));
        }
        return cookie;
    }

    public boolean belongsTo(String targetDomain) {
        if (domain == null) {
            return false;
        }
        String d = domain.startsWith(".") ? domain.substring(1) : domain;
        d = d.toLowerCase(Locale.ROOT);
        return d.equals(targetDomain) || d.endsWith("." + targetDomain);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
