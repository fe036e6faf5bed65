package com.vidnyan.tabula;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration properties for CNV loading and date-coded fields.
 * Can be configured via application.properties or application.yml
 */
@Data
@Component
@ConfigurationProperties(prefix = "tabula")
public class TabulaProperties {

    private Cnv cnv = new Cnv();

    private Years years = new Years();

    @Data
    public static class Cnv {

        /**
         * Resource pattern of the CNV tables to load.
         */
        private String location = "classpath*:cnv/*.cnv";

        /**
         * Encoding of the CNV files. The published tables are Latin-1.
         */
        private String charset = "ISO-8859-1";
    }

    @Data
    public static class Years {

        /**
         * Highest two-digit year read as 20xx; anything above is 19xx.
         */
        private int maxTwentyFirstCenturyYear = 39;
    }
}
