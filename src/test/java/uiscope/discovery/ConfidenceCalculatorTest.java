package uiscope.discovery;

import org.testng.annotations.Test;
import uiscope.bounds.Bounds;
import uiscope.model.UIElement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class ConfidenceCalculatorTest {

    @Test(description = "A plain sibling keeps the base confidence")
    public void plainSibling_isBase() {
        UIElement plain = UIElement.builder("p").bounds(0, 0, 10, 10).build();
        assertThat(ConfidenceCalculator.base(plain, Relationship.SIBLING)).isCloseTo(0.5, within(1e-9));
    }

    @Test(description = "A hidden text label below the target saturates at 1.0")
    public void hiddenTextChild_isCapped() {
        UIElement label = UIElement.builder("l").bounds(Bounds.ZERO).text("首页").build();
        assertThat(ConfidenceCalculator.base(label, Relationship.DIRECT_CHILD)).isEqualTo(1.0);
    }

    @Test(description = "Visible text on a descendant earns the child text bonus, not the hidden one")
    public void visibleTextChild() {
        UIElement label = UIElement.builder("l").bounds(0, 0, 100, 40).text("Home").build();
        assertThat(ConfidenceCalculator.base(label, Relationship.GRANDCHILD)).isCloseTo(1.0, within(1e-9));
        assertThat(ConfidenceCalculator.base(label, Relationship.SIBLING)).isCloseTo(0.8, within(1e-9));
    }

    @Test(description = "A direct parent with a resource id gets the id and parent bonuses")
    public void parentWithResourceId() {
        UIElement nav = UIElement.builder("n").bounds(0, 0, 1080, 200).resourceId("app:id/nav").build();
        assertThat(ConfidenceCalculator.forAncestor(nav, 1)).isCloseTo(0.7, within(1e-9));
    }

    @Test(description = "Ancestor confidence is divided by the distance")
    public void ancestor_decaysWithDistance() {
        UIElement plain = UIElement.builder("p").bounds(0, 0, 10, 10).build();
        assertThat(ConfidenceCalculator.forAncestor(plain, 2)).isCloseTo(0.3, within(1e-9));
        assertThat(ConfidenceCalculator.forAncestor(plain, 3)).isCloseTo(0.2, within(1e-9));
    }

    @Test
    public void clamp_keepsUnitInterval() {
        assertThat(ConfidenceCalculator.clamp(1.7)).isEqualTo(1.0);
        assertThat(ConfidenceCalculator.clamp(-0.2)).isEqualTo(0.0);
        assertThat(ConfidenceCalculator.clamp(Double.NaN)).isEqualTo(0.0);
    }
}
