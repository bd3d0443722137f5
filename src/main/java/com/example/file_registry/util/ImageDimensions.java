package com.example.file_registry.util;

import java.io.IOException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Optional;
import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads width and height from an image header without decoding the pixels. */
public final class ImageDimensions {
  private static final Logger log = LoggerFactory.getLogger(ImageDimensions.class);

  private ImageDimensions() {}

  public record Size(int width, int height) {}

  public static Optional<Size> read(InputStream content) {
    try (ImageInputStream input = ImageIO.createImageInputStream(content)) {
      if (input == null) {
        return Optional.empty();
      }
      Iterator<ImageReader> readers = ImageIO.getImageReaders(input);
      if (!readers.hasNext()) {
        return Optional.empty();
      }
      ImageReader reader = readers.next();
      try {
        reader.setInput(input, true, true);
        return Optional.of(new Size(reader.getWidth(0), reader.getHeight(0)));
      } finally {
        reader.dispose();
      }
    } catch (IOException e) {
      log.debug("Could not read image dimensions: {}", e.getMessage());
      return Optional.empty();
    }
  }
}
