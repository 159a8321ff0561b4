package org.irnorm.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.irnorm.compiler.analysis.HarmonizerPolicy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Typed, immutable view of the {@code normalizer} configuration block.
 *
 * @param passes The ordered pass names to run.
 * @param reservedWords Target-language words that may not be used as variable names.
 * @param reservedWordSuffix The suffix appended to sanitize a reserved name.
 * @param payloadNamePriority The tagged-payload tie-break list, highest priority first.
 * @param rebindCalls Qualified call names ({@code Module.function}) treated as receiver mutations.
 * @param failOnUnboundReference Whether an unresolved read after the pipeline is fatal.
 * @param dumpIrAfterEachPass Whether to log the tree after every pass at TRACE level.
 */
public record NormalizerConfig(
        List<String> passes,
        Set<String> reservedWords,
        String reservedWordSuffix,
        List<String> payloadNamePriority,
        Set<String> rebindCalls,
        boolean failOnUnboundReference,
        boolean dumpIrAfterEachPass
) {

    private static final String ROOT = "normalizer";

    public NormalizerConfig {
        passes = List.copyOf(passes);
        reservedWords = Set.copyOf(reservedWords);
        payloadNamePriority = List.copyOf(payloadNamePriority);
        rebindCalls = Set.copyOf(rebindCalls);
    }

    /**
     * Reads the {@code normalizer} block.
     *
     * @param config A resolved configuration containing the block.
     * @return The typed view.
     * @throws com.typesafe.config.ConfigException if a key is missing or has the wrong type.
     */
    public static NormalizerConfig fromConfig(Config config) {
        Config c = config.getConfig(ROOT);
        return new NormalizerConfig(
                c.getStringList("passes"),
                new LinkedHashSet<>(c.getStringList("reserved-words")),
                c.getString("reserved-word-suffix"),
                c.getStringList("harmonizer.payload-name-priority"),
                new LinkedHashSet<>(c.getStringList("discard.rebind-calls")),
                c.getBoolean("fail-on-unbound-reference"),
                c.getBoolean("dump-ir-after-each-pass"));
    }

    /**
     * @return The classpath defaults from {@code reference.conf}.
     */
    public static NormalizerConfig defaults() {
        return fromConfig(ConfigFactory.parseResources("reference.conf").resolve());
    }

    /**
     * @return The harmonizer policy derived from this configuration.
     */
    public HarmonizerPolicy harmonizerPolicy() {
        return new HarmonizerPolicy(payloadNamePriority);
    }

    public NormalizerConfig withPasses(List<String> newPasses) {
        return new NormalizerConfig(newPasses, reservedWords, reservedWordSuffix, payloadNamePriority,
                rebindCalls, failOnUnboundReference, dumpIrAfterEachPass);
    }

    public NormalizerConfig withFailOnUnboundReference(boolean fail) {
        return new NormalizerConfig(passes, reservedWords, reservedWordSuffix, payloadNamePriority,
                rebindCalls, fail, dumpIrAfterEachPass);
    }
}
