package com.codemeter.core.renderer;

/**
 * Options shared by all report renderers.
 *
 * @param colors whether ANSI colors may be used
 */
public record RenderOptions(
    boolean colors
) {
    public static RenderOptions defaults() {
        return new RenderOptions(true);
    }

    public static RenderOptions plain() {
        return new RenderOptions(false);
    }
}
