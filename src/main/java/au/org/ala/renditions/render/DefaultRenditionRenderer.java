package au.org.ala.renditions.render;

import au.org.ala.renditions.pipeline.PipelineStep;
import au.org.ala.renditions.pipeline.RenditionPipeline;
import au.org.ala.renditions.source.ImageReaders;
import au.org.ala.renditions.source.SourceImage;
import com.google.common.base.Stopwatch;
import com.google.common.io.ByteSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * Decodes the source with ImageIO, applies each pipeline step in order and writes the encoded bytes in one go.
 */
public class DefaultRenditionRenderer implements RenditionRenderer {

    private static final Logger log = LoggerFactory.getLogger(DefaultRenditionRenderer.class);

    private final ImageEncoder encoder;

    public DefaultRenditionRenderer() {
        this(new ImageEncoder());
    }

    public DefaultRenditionRenderer(ImageEncoder encoder) {
        this.encoder = encoder;
    }

    @Override
    public void render(SourceImage source, RenditionPipeline pipeline, ByteSink output) throws IOException {
        Stopwatch sw = Stopwatch.createStarted();
        BufferedImage image = decode(source);
        for (PipelineStep step : pipeline.getSteps()) {
            image = step.getOperation().apply(image);
        }
        byte[] encoded = encoder.encode(image, pipeline.getFormat(), pipeline.getEncodeOptions());
        output.write(encoded);
        log.debug("Rendered {} as {} ({} bytes) in {}", source.getPath(), pipeline.getFileName(), encoded.length, sw);
    }

    protected BufferedImage decode(SourceImage source) throws IOException {
        try (ImageInputStream iis = ImageIO.createImageInputStream(source.getPath().toFile())) {
            ImageReader reader = ImageReaders.open(iis);
            try {
                return reader.read(0);
            } finally {
                reader.dispose();
            }
        }
    }
}
