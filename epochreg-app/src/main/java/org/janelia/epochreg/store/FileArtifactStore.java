package org.janelia.epochreg.store;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.janelia.epochreg.naming.ArtifactNamer;
import org.janelia.epochreg.spec.ArtifactKind;
import org.janelia.epochreg.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Artifact store that uses existence of the canonical science file as its only cache key.
 *
 * @author Eric Trautman
 */
public class FileArtifactStore
        implements ArtifactStore {

    @Override
    public boolean exists(final File scienceArtifact) {
        return scienceArtifact.isFile();
    }

    @Override
    public File pathFor(final File scienceArtifact,
                        final ArtifactKind kind) {
        return ArtifactNamer.getSibling(scienceArtifact, kind);
    }

    @Override
    public List<File> invalidate(final File scienceArtifact)
            throws IOException {

        final List<File> removedFiles = new ArrayList<>();
        for (final ArtifactKind kind : ArtifactKind.values()) {
            final File artifact = pathFor(scienceArtifact, kind);
            if (FileUtil.deleteIfExists(artifact)) {
                removedFiles.add(artifact);
            }
        }

        LOG.info("invalidate: removed {} artifacts for {}", removedFiles.size(), scienceArtifact.getName());

        return removedFiles;
    }

    @Override
    public boolean needsRun(final File scienceArtifact,
                            final boolean clobber)
            throws IOException {
        final boolean needsRun = ArtifactStore.super.needsRun(scienceArtifact, clobber);
        if (! needsRun) {
            LOG.info("needsRun: {} exists, not clobbering", scienceArtifact.getName());
        }
        return needsRun;
    }

    private static final Logger LOG = LoggerFactory.getLogger(FileArtifactStore.class);
}
