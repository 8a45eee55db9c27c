package org.janelia.epochreg.external;

import java.io.File;
import java.util.List;

import org.janelia.epochreg.error.CollaboratorFailureException;

/**
 * Pixel level operations on science, weight and mask images.
 * Each operation returns its output file and leaves existing outputs alone unless clobber is requested.
 *
 * @author Eric Trautman
 */
public interface PixelArithmetic {

    /** Writes image minus template. */
    File subtract(final File templateScience,
                  final File science,
                  final File output,
                  final boolean clobber)
            throws CollaboratorFailureException;

    /** Writes the inverse variance weight map for a difference of two images. */
    File combineWeights(final File weight,
                        final File templateWeight,
                        final File output,
                        final boolean clobber)
            throws CollaboratorFailureException;

    /** Writes the union of two bad pixel masks. */
    File unionMask(final File templateMask,
                   final File mask,
                   final File output,
                   final boolean clobber)
            throws CollaboratorFailureException;

    /** Writes a copy of the image with masked pixels zeroed. */
    File applyMask(final File science,
                   final File mask,
                   final File output,
                   final boolean clobber)
            throws CollaboratorFailureException;

    /** Writes the weighted average of the images and its combined weight map. */
    File weightedAverage(final List<File> scienceList,
                         final List<File> weightList,
                         final File output,
                         final File outputWeight,
                         final boolean clobber)
            throws CollaboratorFailureException;

}
