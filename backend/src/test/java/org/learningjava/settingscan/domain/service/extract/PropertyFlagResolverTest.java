package org.learningjava.settingscan.domain.service.extract;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.learningjava.settingscan.domain.service.extract.SettingTrees.*;

class PropertyFlagResolverTest {

    private final PropertyFlagResolver resolver = new PropertyFlagResolver("Property");

    @Test
    void short_form_resolves_like_long_form() {
        assertEquals(List.of("Dynamic"), resolver.resolve(List.of(flagArg("Property", "Dynamic"))));
        assertEquals(List.of("Dynamic"), resolver.resolve(List.of(flagArg("Setting", "Property", "Dynamic"))));
    }

    @Test
    void flags_of_all_arguments_are_collected_in_order() {
        var flags = resolver.resolve(List.of(
                stringArg("index.refresh_interval"),
                numberArg("1"),
                flagArg("Setting", "Property", "Dynamic"),
                flagArg("Property", "IndexScope")));

        assertEquals(List.of("Dynamic", "IndexScope"), flags);
    }

    @Test
    void repeated_flags_are_kept() {
        var flags = resolver.resolve(List.of(
                flagArg("Property", "Dynamic"),
                flagArg("Setting", "Property", "Dynamic")));

        assertEquals(List.of("Dynamic", "Dynamic"), flags);
    }

    @Test
    void arguments_without_anchor_yield_nothing() {
        assertTrue(resolver.resolve(List.of(flagArg("ByteSizeUnit", "MB"), stringArg("Property"))).isEmpty());
    }

    @Test
    void blank_anchor_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new PropertyFlagResolver(""));
    }
}
