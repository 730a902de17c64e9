package org.learningjava.settingscan.domain.service.extract;

import org.learningjava.settingscan.domain.model.uast.UastNode;
import org.learningjava.settingscan.domain.model.uast.UastRoles;
import org.learningjava.settingscan.domain.model.uast.UastTags;
import org.learningjava.settingscan.domain.service.query.UastPath;

import java.util.ArrayList;
import java.util.List;

/**
 * Pulls property flags such as {@code Dynamic} out of setting arguments.
 * <p>
 * A flag is written either as {@code Setting.Property.Dynamic} or, with {@code Property}
 * imported, as {@code Property.Dynamic}. The short query also matches the inner
 * {@code Setting.Property} of the long spelling, so per argument the long query wins.
 */
public class PropertyFlagResolver {

    private final UastPath longForm;
    private final UastPath shortForm;

    public PropertyFlagResolver(String anchorName) {
        if (anchorName == null || anchorName.isBlank()) {
            throw new IllegalArgumentException("Property anchor name must not be blank");
        }
        this.longForm = UastPath.descendant(UastTags.QUALIFIED_NAME)
                .thenChild(UastTags.QUALIFIED_NAME)
                .thenChild(UastTags.SIMPLE_NAME).withToken(anchorName)
                .parent().parent()
                .thenChild(UastTags.SIMPLE_NAME).withRole(UastRoles.NAME);
        this.shortForm = UastPath.descendant(UastTags.QUALIFIED_NAME)
                .thenChild(UastTags.SIMPLE_NAME).withToken(anchorName)
                .parent()
                .thenChild(UastTags.SIMPLE_NAME).withRole(UastRoles.NAME);
    }

    public List<String> resolve(List<UastNode> arguments) {
        List<String> flags = new ArrayList<>();
        for (UastNode argument : arguments) {
            List<UastNode> matches = longForm.evaluate(argument);
            if (matches.isEmpty()) {
                matches = shortForm.evaluate(argument);
            }
            for (UastNode m : matches) {
                flags.add(m.token());
            }
        }
        return flags;
    }
}
