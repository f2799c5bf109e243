package com.html2md.core.convert;

import com.html2md.core.config.ConverterOptions;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ConversionContextTest {

    private final ConverterOptions options = ConverterOptions.defaults().withKeepDataUris(true);

    @Test
    void root_usesBulletMarkerAndDataCells() {
        ConversionContext context = ConversionContext.root(options);

        assertThat(context.options()).isSameAs(options);
        assertThat(context.listMarker()).isEqualTo("- ");
        assertThat(context.inListItem()).isFalse();
        assertThat(context.cellTag()).isEqualTo("td");
        assertThat(context.depth()).isZero();
    }

    @Test
    void withMethods_returnCopiesAndLeaveOriginalUnchanged() {
        ConversionContext root = ConversionContext.root(options);

        ConversionContext changed = root.withListMarker("3. ").withInListItem(true).withCellTag("th");

        assertThat(changed.listMarker()).isEqualTo("3. ");
        assertThat(changed.inListItem()).isTrue();
        assertThat(changed.cellTag()).isEqualTo("th");
        assertThat(root).isEqualTo(ConversionContext.root(options));
    }

    @Test
    void reset_keepsOptionsAndDepth() {
        ConversionContext nested = ConversionContext.root(options)
            .descend().descend()
            .withListMarker("2. ").withInListItem(true).withCellTag("th");

        ConversionContext reset = nested.reset();

        assertThat(reset.options()).isSameAs(options);
        assertThat(reset.depth()).isEqualTo(2);
        assertThat(reset.listMarker()).isEqualTo("- ");
        assertThat(reset.inListItem()).isFalse();
        assertThat(reset.cellTag()).isEqualTo("td");
    }

    @Test
    void descend_incrementsDepth() {
        assertThat(ConversionContext.root(options).descend().descend().descend().depth()).isEqualTo(3);
    }

    @Test
    void constructor_nullOptions_throwsException() {
        assertThatThrownBy(() -> new ConversionContext(null, "- ", false, "td", 0))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("options must not be null");
    }
}
