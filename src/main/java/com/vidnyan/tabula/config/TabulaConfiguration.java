package com.vidnyan.tabula.config;

import com.vidnyan.tabula.TabulaProperties;
import com.vidnyan.tabula.domain.time.TwoDigitYearWindow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration for Tabula components.
 */
@Slf4j
@Configuration
public class TabulaConfiguration {

    /**
     * Two-digit year window used for aa/aamm fields.
     */
    @Bean
    public TwoDigitYearWindow twoDigitYearWindow(TabulaProperties properties) {
        TwoDigitYearWindow window = new TwoDigitYearWindow(properties.getYears().getMaxTwentyFirstCenturyYear());
        log.info("Two-digit years map to {}..{}", window.minimumYear(), window.maximumYear());
        return window;
    }
}
