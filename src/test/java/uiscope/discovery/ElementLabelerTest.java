package uiscope.discovery;

import org.testng.annotations.Test;
import uiscope.model.UIElement;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class ElementLabelerTest {

    @Test(description = "Text, short resource id and short type are joined")
    public void label_allParts() {
        UIElement login = UIElement.builder("1")
                .text("登录")
                .resourceId("com.app:id/login_btn")
                .elementType("android.widget.Button")
                .build();
        assertThat(ElementLabeler.label(login)).isEqualTo("登录 @login_btn (Button)");
    }

    @Test(description = "Long text is cut at twenty characters")
    public void label_truncatesText() {
        UIElement e = UIElement.builder("2").text("Terms of service and privacy policy").build();
        assertThat(ElementLabeler.label(e)).isEqualTo("Terms of service and...");
    }

    @Test(description = "Only visible text goes into the label, not the content description")
    public void label_ignoresDescription() {
        UIElement described = UIElement.builder("3").contentDesc("Search").build();
        assertThat(ElementLabeler.label(described)).isEqualTo("element_3");

        UIElement icon = UIElement.builder("4").contentDesc("Search").resourceId("app:id/search_btn").build();
        assertThat(ElementLabeler.label(icon)).isEqualTo("@search_btn");
    }

    @Test(description = "An element with nothing to show is labelled by its id")
    public void label_bareElement() {
        assertThat(ElementLabeler.label(UIElement.builder("7").build())).isEqualTo("element_7");
    }

    @Test
    public void similarity_countsMatchingAttributes() {
        UIElement a = UIElement.builder("a").elementType("android.widget.TextView").resourceId("app:id/t").text("A").build();
        UIElement b = UIElement.builder("b").elementType("android.widget.TextView").resourceId("app:id/t").text("B").build();
        UIElement c = UIElement.builder("c").elementType("android.widget.Button").clickable(true).build();

        assertThat(ElementLabeler.similarity(a, a)).isEqualTo(1.0);
        assertThat(ElementLabeler.similarity(a, b)).isEqualTo(0.75);
        assertThat(ElementLabeler.similarity(a, c)).isEqualTo(0.0);
    }

    @Test(description = "Missing id and text on both sides are left out of the comparison")
    public void similarity_ignoresAttributesNeitherHas() {
        UIElement frame = UIElement.builder("f").elementType("android.widget.FrameLayout").build();
        UIElement image = UIElement.builder("i").elementType("android.widget.ImageView").build();
        UIElement other = UIElement.builder("o").elementType("android.widget.FrameLayout").build();

        assertThat(ElementLabeler.similarity(frame, image))
                .as("only type and clickability are compared, and only clickability matches")
                .isEqualTo(0.5);
        assertThat(ElementLabeler.similarity(frame, other)).isEqualTo(1.0);

        UIElement titled = UIElement.builder("t").elementType("android.widget.FrameLayout").text("Title").build();
        assertThat(ElementLabeler.similarity(frame, titled))
                .as("text is compared once either side has it")
                .isCloseTo(2.0 / 3.0, within(1e-9));
    }
}
