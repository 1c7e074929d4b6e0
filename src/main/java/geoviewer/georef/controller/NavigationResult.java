package geoviewer.georef.controller;

import geoviewer.georef.model.Viewport;

import java.util.Optional;

/**
 * What a session command hands back to the UI: whether it did anything, the status line to
 * show and, when there is something to look at, the window to display.
 *
 * @param success  false when the command was refused (no data, bad index, missing column)
 * @param index    feature cursor after the command, or -1 without features
 * @param message  status line text
 * @param viewport window to apply, or null when nothing is loaded
 */
public record NavigationResult(boolean success, int index, String message, Viewport viewport) {

    public Optional<Viewport> getViewport() {
        return Optional.ofNullable(viewport);
    }
}
