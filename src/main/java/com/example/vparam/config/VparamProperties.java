package com.example.vparam.config;

import java.time.ZoneId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds properties:
 *
 * vparam.error-class=field-with-error
 * vparam.optional=false
 * vparam.phone-country=7
 * vparam.date-format=yyyy-MM-dd
 * vparam.sort.rows=25
 */
@Data
@ConfigurationProperties(prefix = "vparam")
public class VparamProperties {

    /**
     * CSS class handed out for fields with an error
     */
    private String errorClass = "field-with-error";

    /**
     * Default for fields that do not say whether they are optional
     */
    private boolean optional = false;

    /**
     * Default for fields that do not say whether undefined values are skipped
     */
    private boolean skipundef = false;

    private int passwordMin = 8;

    /**
     * Prefixes added to phone numbers shorter than 11 digits
     */
    private String phoneCountry = "";
    private String phoneRegion = "";

    /**
     * Output patterns for the date types; a blank pattern returns the parsed ZonedDateTime
     */
    private String dateFormat = "yyyy-MM-dd";
    private String timeFormat = "HH:mm:ss";
    private String datetimeFormat = "yyyy-MM-dd HH:mm:ss Z";

    /**
     * Zone for parsing and formatting dates; blank means the system zone
     */
    private String timeZone = "";

    /**
     * Secret used to verify address signatures; blank trusts every address
     */
    private String addressSecret = "";

    private Sort sort = new Sort();

    public ZoneId zone() {
        return timeZone == null || timeZone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(timeZone);
    }

    /**
     * Names and defaults of the paging fields added by validateSorted. A blank name turns the
     * field off.
     */
    @Data
    public static class Sort {
        private String page = "page";
        private String rowsParam = "rws";
        private String orderBy = "oby";
        private String orderDirection = "ods";
        private int rows = 25;
        private String direction = "ASC";
    }
}
