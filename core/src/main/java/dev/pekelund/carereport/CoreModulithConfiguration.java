package dev.pekelund.carereport;

import org.springframework.modulith.Modulithic;

/**
 * Anchor for the core application modules so their boundaries can be verified.
 */
@Modulithic(systemName = "care-report-core")
public final class CoreModulithConfiguration {

    private CoreModulithConfiguration() {
    }
}
