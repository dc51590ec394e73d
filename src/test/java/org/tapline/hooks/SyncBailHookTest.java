package org.tapline.hooks;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

class SyncBailHookTest {

    @Test
    @Tag("unit")
    void testCall_StopsAtFirstNonNullResult() {
        SyncBailHook<String, String> hook = new SyncBailHook<>("decide", "input");
        List<String> invoked = new ArrayList<>();
        hook.tap("A", arg -> {
            invoked.add("A");
            return null;
        });
        hook.tap("B", arg -> {
            invoked.add("B");
            return "x";
        });
        hook.tap("C", arg -> {
            invoked.add("C");
            return null;
        });

        assertThat(hook.call("in")).isEqualTo("x");
        assertThat(invoked).containsExactly("A", "B");
    }

    @Test
    @Tag("unit")
    void testCall_NoTapDecides_ReturnsNull() {
        SyncBailHook<Void, Boolean> hook = new SyncBailHook<>("shouldEmit");
        hook.tap("undecided", arg -> null);

        assertThat(hook.call(null)).isNull();
    }

    @Test
    @Tag("unit")
    void testCall_FalseIsADecision() {
        SyncBailHook<Void, Boolean> hook = new SyncBailHook<>("shouldEmit");
        List<String> invoked = new ArrayList<>();
        hook.tap("veto", arg -> {
            invoked.add("veto");
            return Boolean.FALSE;
        });
        hook.tap("later", arg -> {
            invoked.add("later");
            return Boolean.TRUE;
        });

        assertThat(hook.call(null)).isFalse();
        assertThat(invoked).containsExactly("veto");
    }

    @Test
    @Tag("unit")
    void testCall_TapExceptionPropagates() {
        SyncBailHook<String, String> hook = new SyncBailHook<>("decide");
        hook.tap("broken", arg -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> hook.call("x"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("boom");
    }
}
