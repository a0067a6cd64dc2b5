package au.org.ala.renditions.render;

import au.org.ala.renditions.pipeline.RenditionPipeline;
import au.org.ala.renditions.source.SourceImage;
import com.google.common.io.ByteSink;

import java.io.IOException;

/**
 * Decodes a source image, runs it through a pipeline and writes the encoded result.
 */
public interface RenditionRenderer {

    void render(SourceImage source, RenditionPipeline pipeline, ByteSink output) throws IOException;
}
