package com.purchasingpower.stocksync.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings of the view model synchronisation layer.
 *
 * <p>Properties are loaded from the {@code app.sync} namespace in application.yml:
 * <pre>
 * app:
 *   sync:
 *     refresh-dependents: true
 *     choice-label-property: name
 * </pre>
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.sync")
public class SyncProperties {

    /**
     * Reload a list when an entity type its foreign keys reference changes.
     * Default: true
     */
    private boolean refreshDependents = true;

    /**
     * Property used as the label of a foreign-key choice; rows without it are labelled by key.
     * Default: name
     */
    @NotBlank
    private String choiceLabelProperty = "name";
}
