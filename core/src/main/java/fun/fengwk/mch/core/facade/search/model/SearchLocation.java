package fun.fengwk.mch.core.facade.search.model;

import lombok.Builder;
import lombok.Value;
import org.springframework.util.StringUtils;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Approximate user location used to bias web search.
 *
 * @author fengwk
 */
@Value
@Builder
public class SearchLocation {

    /**
     * ISO-3166-1 alpha-2.
     */
    private static final Pattern COUNTRY_PATTERN = Pattern.compile("^[A-Za-z]{2}$");

    String city;
    String region;
    String country;

    public static boolean isValidCountry(String country) {
        return country != null && COUNTRY_PATTERN.matcher(country.trim()).matches();
    }

    /**
     * Trim fields, drop an invalid country and return null when nothing usable is left.
     */
    public static SearchLocation sanitize(SearchLocation location) {
        if (location == null) {
            return null;
        }
        String city = trimToNull(location.getCity());
        String region = trimToNull(location.getRegion());
        String country = isValidCountry(location.getCountry())
            ? location.getCountry().trim().toUpperCase(Locale.ROOT)
            : null;
        if (city == null && region == null && country == null) {
            return null;
        }
        return SearchLocation.builder()
            .city(city)
            .region(region)
            .country(country)
            .build();
    }

    /**
     * Stable lower-cased form used in cache keys.
     */
    public String canonicalKey() {
        return lower(country) + "/" + lower(region) + "/" + lower(city);
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }

    private static String lower(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }

}
