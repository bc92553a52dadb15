package com.codemeter.core.renderer;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up {@link ReportRenderer} implementations registered with {@link ServiceLoader}.
 */
public final class ReportRenderers {

    private ReportRenderers() {
    }

    /**
     * Returns every registered renderer, sorted by id.
     *
     * @return registered renderers
     */
    public static List<ReportRenderer> all() {
        return ServiceLoader.load(ReportRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .sorted(Comparator.comparing(ReportRenderer::getId))
            .toList();
    }

    /**
     * Finds a renderer by id, ignoring case.
     *
     * @param id renderer id
     * @return the renderer, or empty if none is registered under that id
     */
    public static Optional<ReportRenderer> find(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return all().stream()
            .filter(renderer -> renderer.getId().equalsIgnoreCase(id))
            .findFirst();
    }
}
