package com.shlawgathon.leafscan.backend.dataset;

import com.shlawgathon.leafscan.backend.exception.CorpusAccessException;
import com.shlawgathon.leafscan.backend.exception.InvalidImageException;
import com.shlawgathon.leafscan.backend.model.Category;
import com.shlawgathon.leafscan.backend.model.LabeledImage;
import com.shlawgathon.leafscan.backend.model.PixelGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Corpus laid out as {@code <root>/<category>/<image>.(jpg|jpeg|png)}. The folder name is the category label and
 * {@code <root name>/<category>/<file name>} is the image id, so two roots sharing file names do not collide.
 */
public class DatasetDirectoryImageSource implements LabeledImageSource {

    private static final Logger log = LoggerFactory.getLogger(DatasetDirectoryImageSource.class);

    private static final Set<String> EXTENSIONS = Set.of(".jpg", ".jpeg", ".png");

    private final Path root;

    public DatasetDirectoryImageSource(Path root) {
        this.root = root;
    }

    @Override
    public List<LabeledImage> images() {
        if (!Files.isDirectory(root)) {
            throw new CorpusAccessException("Dataset directory not found: " + root);
        }
        String prefix = rootName();
        List<LabeledImage> images = new ArrayList<>();
        for (Path categoryDir : list(root).stream().filter(Files::isDirectory).collect(Collectors.toList())) {
            Category category = Category.of(categoryDir.getFileName().toString());
            List<Path> files = list(categoryDir).stream()
                    .filter(Files::isRegularFile)
                    .filter(DatasetDirectoryImageSource::isImage)
                    .collect(Collectors.toList());
            for (Path file : files) {
                images.add(LabeledImage.builder()
                        .id(prefix + category.getLabel() + "/" + file.getFileName())
                        .category(category)
                        .sourceReference(file.toString())
                        .pixels(() -> decode(file))
                        .build());
            }
            log.info("Found {} images in category {}", files.size(), category);
        }
        return images;
    }

    private String rootName() {
        Path name = root.toAbsolutePath().normalize().getFileName();
        return name == null ? "" : name + "/";
    }

    static boolean isImage(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return dot >= 0 && EXTENSIONS.contains(name.substring(dot));
    }

    /**
     * Decodes one image file into RGB pixels.
     *
     * @throws InvalidImageException if the file cannot be read or is not a color image
     */
    public static PixelGrid decode(Path file) {
        BufferedImage image;
        try {
            image = ImageIO.read(file.toFile());
        } catch (IOException e) {
            throw new InvalidImageException("Cannot read image " + file, e);
        }
        if (image == null) {
            throw new InvalidImageException("Unsupported or corrupt image " + file);
        }
        int components = image.getColorModel().getColorSpace().getNumComponents();
        if (components < 3) {
            throw new InvalidImageException("Image " + file + " has " + components
                    + " color channel(s), at least 3 are needed");
        }
        int width = image.getWidth();
        int height = image.getHeight();
        return PixelGrid.fromPackedRgb(width, height, image.getRGB(0, 0, width, height, null, 0, width));
    }

    private static List<Path> list(Path dir) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.sorted().collect(Collectors.toList());
        } catch (IOException e) {
            throw new CorpusAccessException("Cannot list " + dir, e);
        }
    }
}
