package com.example.geotagger.mutation;

import org.apache.commons.imaging.ImageReadException;
import org.apache.commons.imaging.ImageWriteException;
import org.apache.commons.imaging.Imaging;
import org.apache.commons.imaging.common.ImageMetadata;
import org.apache.commons.imaging.formats.jpeg.JpegImageMetadata;
import org.apache.commons.imaging.formats.jpeg.exif.ExifRewriter;
import org.apache.commons.imaging.formats.tiff.TiffImageMetadata;
import org.apache.commons.imaging.formats.tiff.write.TiffOutputSet;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Sets the GPS IFD of a JPEG without re-encoding the image data. Other EXIF fields are kept.
 */
public class ExifGpsWriter implements GpsTagWriter {

    @Override
    public void write(Path image, double lat, double lon) throws IOException {
        Path rewritten = Files.createTempFile(image.toAbsolutePath().getParent(), "exif-", ".jpg");
        try {
            TiffOutputSet outputSet = existingOutputSet(image);
            outputSet.setGPSInDegrees(lon, lat);
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(rewritten))) {
                new ExifRewriter().updateExifMetadataLossless(image.toFile(), out, outputSet);
            }
            Files.move(rewritten, image, StandardCopyOption.REPLACE_EXISTING);
        } catch (ImageReadException | ImageWriteException ex) {
            throw new IOException("Failed to write GPS EXIF to " + image, ex);
        } finally {
            Files.deleteIfExists(rewritten);
        }
    }

    private TiffOutputSet existingOutputSet(Path image) throws IOException, ImageReadException, ImageWriteException {
        ImageMetadata metadata = Imaging.getMetadata(image.toFile());
        if (metadata instanceof JpegImageMetadata) {
            TiffImageMetadata exif = ((JpegImageMetadata) metadata).getExif();
            if (exif != null) {
                return exif.getOutputSet();
            }
        }
        return new TiffOutputSet();
    }
}
