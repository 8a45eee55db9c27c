package org.janelia.epochreg.store;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.janelia.epochreg.spec.ArtifactKind;

/**
 * Decides whether stage artifacts must be (re)built.
 * Artifacts are addressed by their canonical science file, other kinds are siblings of it.
 *
 * @author Eric Trautman
 */
public interface ArtifactStore {

    /**
     * @return true if the specified science artifact is available.
     */
    boolean exists(final File scienceArtifact);

    /**
     * @return path of the specified kind of artifact that accompanies the science artifact.
     */
    File pathFor(final File scienceArtifact,
                 final ArtifactKind kind);

    /**
     * Removes the science artifact along with all of its sibling artifacts.
     *
     * @return list of removed files.
     *
     * @throws IOException
     *   if an existing artifact cannot be removed.
     */
    List<File> invalidate(final File scienceArtifact)
            throws IOException;

    /**
     * @param  scienceArtifact  canonical output of a unit of work.
     * @param  clobber          true if existing artifacts should be rebuilt.
     *
     * @return true if the unit of work must run (stale artifacts are invalidated first when clobbering);
     *         false if the existing artifact should be kept.
     *
     * @throws IOException
     *   if stale artifacts cannot be removed.
     */
    default boolean needsRun(final File scienceArtifact,
                             final boolean clobber)
            throws IOException {
        boolean needsRun = true;
        if (exists(scienceArtifact)) {
            if (clobber) {
                invalidate(scienceArtifact);
            } else {
                needsRun = false;
            }
        }
        return needsRun;
    }

}
