package io.github.sarps.solarpatch.instrument;

import io.github.sarps.solarpatch.config.SolarPatchConfigManager;
import io.github.sarps.solarpatch.exception.ConfigurationException;
import io.github.sarps.solarpatch.model.RecodeTable;
import io.github.sarps.solarpatch.utilities.ObservationDates;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Explicit lookup table from instrument names and observation dates to {@link InstrumentProvider}s.
 *
 * <p>The table is built once from configuration and never changes; there is no
 * registration at class-loading time. Two lookups are offered:</p>
 * <ul>
 *   <li><strong>By date:</strong> {@link #forDate(LocalDateTime)} returns the provider whose
 *       coverage contains the date. Where coverages overlap (HMI and MDI both observed from
 *       April 2009 to October 2010) the primary instrument wins.</li>
 *   <li><strong>By name:</strong> {@link #forName(String)} matches case-insensitively.</li>
 * </ul>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * InstrumentRegistry registry = InstrumentRegistry.fromConfig(SolarPatchConfigManager.loadDefault());
 * InstrumentProvider provider = registry.forDate(ObservationDates.parse("2003.10.28_11:00:00")); // MDI
 * }</pre>
 *
 * @since 0.1.0
 * @see InstrumentProvider
 */
public final class InstrumentRegistry {
    private static final Logger logger = LoggerFactory.getLogger(InstrumentRegistry.class);

    private final Map<String, InstrumentProvider> providers;

    /**
     * @param providers the providers, at most one per name
     * @throws IllegalArgumentException on duplicate names
     */
    public InstrumentRegistry(List<InstrumentProvider> providers) {
        Map<String, InstrumentProvider> byName = new LinkedHashMap<>();
        // primary first so that overlapping coverage resolves to it
        List<InstrumentProvider> ordered = new ArrayList<>(providers);
        ordered.sort(Comparator.comparing(InstrumentProvider::role));
        for (InstrumentProvider provider : ordered) {
            String key = normalize(provider.name());
            if (byName.put(key, provider) != null) {
                throw new IllegalArgumentException("Duplicate instrument name: " + provider.name());
            }
        }
        this.providers = Collections.unmodifiableMap(byName);
        logger.info("Instrument registry contains {} providers: {}", byName.size(), byName.keySet());
    }

    /**
     * Builds the registry from every instrument in a configuration.
     *
     * @throws ConfigurationException if an instrument section is incomplete, or a secondary
     *         instrument lacks a recode table
     */
    public static InstrumentRegistry fromConfig(SolarPatchConfigManager config) {
        List<InstrumentProvider> providers = new ArrayList<>();
        for (String name : config.getInstrumentNames()) {
            InstrumentProfile profile = config.getInstrumentProfile(name);
            if (profile.role() == InstrumentRole.PRIMARY) {
                providers.add(new PrimaryInstrumentProvider(profile));
            } else {
                RecodeTable table = config.getRecodeTable(name).orElseThrow(() ->
                        new ConfigurationException("Secondary instrument " + name + " has no recode table"));
                providers.add(new SecondaryInstrumentProvider(profile, table));
            }
        }
        if (providers.isEmpty()) {
            throw new ConfigurationException("No instruments configured in " + config.getSource());
        }
        return new InstrumentRegistry(providers);
    }

    /**
     * Selects the provider for an observation date.
     *
     * @throws ConfigurationException if no configured instrument covers the date
     */
    public InstrumentProvider forDate(LocalDateTime observationDate) {
        if (observationDate == null) {
            throw new IllegalArgumentException("Observation date must not be null");
        }
        for (InstrumentProvider provider : providers.values()) {
            if (provider.covers(observationDate)) {
                logger.info("Selected {} for observation {}", provider.profile().displayName(),
                        ObservationDates.format(observationDate));
                return provider;
            }
        }
        logger.error("No instrument covers {}", ObservationDates.format(observationDate));
        throw new ConfigurationException("No configured instrument covers observation date "
                + ObservationDates.format(observationDate));
    }

    /**
     * Looks up a provider by name, ignoring case and surrounding blanks.
     */
    public Optional<InstrumentProvider> forName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(providers.get(normalize(name)));
    }

    /**
     * @return all providers, primary first
     */
    public List<InstrumentProvider> getProviders() {
        return List.copyOf(providers.values());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase();
    }
}
