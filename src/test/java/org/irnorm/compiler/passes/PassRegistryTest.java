package org.irnorm.compiler.passes;

import org.irnorm.compiler.passes.structural.BlockFlatteningPass;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class PassRegistryTest {

    @Test
    void testCreate_ReturnsFreshInstances() {
        PassRegistry registry = PassRegistry.initializeWithDefaults();

        INormalizationPass first = registry.create(BlockFlatteningPass.NAME).orElseThrow();
        INormalizationPass second = registry.create(BlockFlatteningPass.NAME).orElseThrow();

        assertThat(first).isInstanceOf(BlockFlatteningPass.class).isNotSameAs(second);
        assertThat(registry.create("missing")).isEmpty();
    }

    @Test
    void testRegister_DuplicateNameFails() {
        PassRegistry registry = new PassRegistry();
        registry.register(BlockFlatteningPass::new);

        assertThatThrownBy(() -> registry.register(BlockFlatteningPass::new))
                .isInstanceOf(PipelineConfigurationException.class)
                .hasMessageContaining(BlockFlatteningPass.NAME);
    }
}
