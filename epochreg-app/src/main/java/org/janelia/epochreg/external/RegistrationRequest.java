package org.janelia.epochreg.external;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.janelia.epochreg.parameters.RegistrationParameters;
import org.janelia.epochreg.spec.SkyPosition;

/**
 * Everything a {@link Registrar} needs to align a set of images.
 *
 * <ul>
 *     <li>With a reference image and/or catalog, images are aligned to the reference.</li>
 *     <li>With a single source position, the brightest source of each image is centered on it.</li>
 *     <li>With neither, images are aligned to each other (intra-visit registration).</li>
 * </ul>
 *
 * @author Eric Trautman
 */
public class RegistrationRequest {

    private final File workingDirectory;
    private final List<String> imageNames;
    private final File referenceImage;
    private final File referenceCatalog;
    private final SkyPosition singleSourcePosition;
    private final String wcsName;
    private final RegistrationParameters matching;
    private final boolean clobber;

    public RegistrationRequest(final File workingDirectory,
                               final List<String> imageNames,
                               final File referenceImage,
                               final File referenceCatalog,
                               final SkyPosition singleSourcePosition,
                               final String wcsName,
                               final RegistrationParameters matching,
                               final boolean clobber) {
        this.workingDirectory = workingDirectory;
        this.imageNames = new ArrayList<>(imageNames);
        this.referenceImage = referenceImage;
        this.referenceCatalog = referenceCatalog;
        this.singleSourcePosition = singleSourcePosition;
        this.wcsName = wcsName;
        this.matching = matching;
        this.clobber = clobber;
    }

    public File getWorkingDirectory() {
        return workingDirectory;
    }

    public List<String> getImageNames() {
        return Collections.unmodifiableList(imageNames);
    }

    public File getReferenceImage() {
        return referenceImage;
    }

    public File getReferenceCatalog() {
        return referenceCatalog;
    }

    public SkyPosition getSingleSourcePosition() {
        return singleSourcePosition;
    }

    public boolean isSingleSource() {
        return singleSourcePosition != null;
    }

    /**
     * @return name for the fitted WCS solution.
     */
    public String getWcsName() {
        return wcsName;
    }

    public RegistrationParameters getMatching() {
        return matching;
    }

    public boolean isClobber() {
        return clobber;
    }

    @Override
    public String toString() {
        return "{images: " + imageNames + ", wcsName: " + wcsName + '}';
    }
}
