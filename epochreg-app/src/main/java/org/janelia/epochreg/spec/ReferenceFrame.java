package org.janelia.epochreg.spec;

import java.io.File;
import java.io.Serializable;

/**
 * The single image that anchors the common WCS for a run, along with the
 * (epoch, filter, visit) triple it was built from when it was selected by the pipeline.
 *
 * @author Eric Trautman
 */
public class ReferenceFrame
        implements Serializable {

    private final File imageFile;
    private final Integer epoch;
    private final String filter;
    private final String visit;
    private final File catalogFile;

    public ReferenceFrame(final File imageFile) {
        this(imageFile, null, null, null, null);
    }

    public ReferenceFrame(final File imageFile,
                          final Integer epoch,
                          final String filter,
                          final String visit,
                          final File catalogFile) {
        this.imageFile = imageFile.getAbsoluteFile();
        this.epoch = epoch;
        this.filter = filter;
        this.visit = visit;
        this.catalogFile = catalogFile == null ? null : catalogFile.getAbsoluteFile();
    }

    public File getImageFile() {
        return imageFile;
    }

    public boolean exists() {
        return imageFile.exists();
    }

    public Integer getEpoch() {
        return epoch;
    }

    public String getFilter() {
        return filter;
    }

    public String getVisit() {
        return visit;
    }

    public File getCatalogFile() {
        return catalogFile;
    }

    public boolean hasCatalog() {
        return catalogFile != null;
    }

    public ReferenceFrame withCatalog(final File catalog) {
        return new ReferenceFrame(imageFile, epoch, filter, visit, catalog);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(imageFile.getAbsolutePath());
        if (epoch != null) {
            sb.append(" (epoch ").append(epoch).append(", filter ").append(filter).append(", visit ").append(visit).append(')');
        }
        return sb.toString();
    }
}
