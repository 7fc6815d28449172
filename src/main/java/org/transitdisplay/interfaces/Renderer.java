package org.transitdisplay.interfaces;

import org.transitdisplay.errors.RenderException;
import org.transitdisplay.model.Snapshot;

/** Publishes snapshots to the display. Single consumer. */
public interface Renderer {

    /** @throws RenderException if the snapshot could not be shown; fatal to the process */
    void render(Snapshot snapshot) throws RenderException;

    /** Best effort error screen shown before the process exits. Must not throw. */
    void renderError(String message);
}
