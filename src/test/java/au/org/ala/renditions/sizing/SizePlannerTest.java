package au.org.ala.renditions.sizing;

import au.org.ala.renditions.TestBase;
import au.org.ala.renditions.spec.CropRect;
import au.org.ala.renditions.spec.InvalidSpecException;
import au.org.ala.renditions.spec.RenditionSpec;
import au.org.ala.renditions.spec.ResizeMode;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

@RunWith(JUnit4.class)
public class SizePlannerTest extends TestBase {

    private final SizePlanner planner = SizePlanner.INSTANCE;

    @Test
    public void testFitToWidth() {
        SizePlan plan = planner.plan(2000, 1000, RenditionSpec.builder().width(500).build(), 1);
        assertEquals(new RenditionSize(500, 250), plan.getSize());
        assertFalse(plan.getBox().isPresent());
    }

    @Test
    public void testFitToBothLimits() {
        RenditionSpec spec = RenditionSpec.builder().width(300).height(200).build();
        assertEquals(new RenditionSize(200, 200), planner.plan(1000, 1000, spec, 1).getSize());
        assertEquals(new RenditionSize(300, 150), planner.plan(2000, 1000, spec, 1).getSize());
    }

    @Test
    public void testFitMaxWidth() {
        RenditionSpec spec = RenditionSpec.builder().width(800).maxWidth(400).build();
        assertEquals(new RenditionSize(400, 300), planner.plan(1600, 1200, spec, 1).getSize());
    }

    @Test
    public void testFitNeverUpscales() {
        RenditionSpec spec = RenditionSpec.builder().width(500).build();
        assertEquals(new RenditionSize(200, 100), planner.plan(200, 100, spec, 1).getSize());
        // 2x density is capped by the source as well
        assertEquals(new RenditionSize(200, 100), planner.plan(200, 100, spec, 2).getSize());
    }

    @Test
    public void testFitOutputScale() {
        RenditionSpec spec = RenditionSpec.builder().width(500).build();
        assertEquals(new RenditionSize(1000, 500), planner.plan(2000, 1000, spec, 2).getSize());
    }

    @Test
    public void testFitKeepsAspectRatio() {
        int[][] sources = { { 2000, 1000 }, { 1234, 987 }, { 640, 4000 }, { 3000, 3000 } };
        int[] widths = { 50, 333, 500, 1999 };
        for (int[] source : sources) {
            for (int width : widths) {
                RenditionSize size = planner.plan(source[0], source[1], RenditionSpec.builder().width(width).build(), 1).getSize();
                assertTrue(size.width <= width);
                assertTrue(size.width <= source[0]);
                double expected = (double) source[0] / source[1];
                double actual = (double) size.width / size.height;
                assertEquals(expected, actual, expected * 2.0 / Math.min(size.width, size.height));
            }
        }
    }

    @Test
    public void testScaleAndMinimum() {
        assertEquals(new RenditionSize(500, 250),
                planner.plan(2000, 1000, RenditionSpec.builder().scale(4.0).build(), 1).getSize());
        assertEquals(new RenditionSize(800, 400),
                planner.plan(2000, 1000, RenditionSpec.builder().scale(4.0).scaleMinWidth(800).build(), 1).getSize());
    }

    @Test
    public void testFillSquareFromLandscape() {
        RenditionSpec spec = RenditionSpec.builder().resize(ResizeMode.FILL).width(500).height(500).build();
        SizePlan plan = planner.plan(2000, 1000, spec, 1);
        assertEquals(new RenditionSize(500, 500), plan.getSize());
        CropBox box = plan.getBox().get();
        assertEquals("500-0-1500-1000", box.label());
        assertEquals(1000, box.getWidth());
        assertEquals(1000, box.getHeight());
    }

    @Test
    public void testFillAnchor() {
        RenditionSpec left = RenditionSpec.builder().resize(ResizeMode.FILL).width(500).height(500).fillCrop(0, 0.5).build();
        assertEquals("0-0-1000-1000", planner.plan(2000, 1000, left, 1).getBox().get().label());

        RenditionSpec bottom = RenditionSpec.builder().resize(ResizeMode.FILL).width(400).height(100).fillCrop(0.5, 1).build();
        SizePlan plan = planner.plan(1000, 1000, bottom, 1);
        assertEquals(new RenditionSize(400, 100), plan.getSize());
        assertEquals("0-750-1000-1000", plan.getBox().get().label());
    }

    @Test
    public void testFillBoxWithinSource() {
        int[][] sources = { { 2000, 1000 }, { 1000, 2000 }, { 777, 333 }, { 50, 50 } };
        int[][] targets = { { 500, 500 }, { 100, 300 }, { 640, 480 }, { 1, 1000 } };
        for (int[] source : sources) {
            for (int[] target : targets) {
                RenditionSpec spec = RenditionSpec.builder().resize(ResizeMode.FILL).width(target[0]).height(target[1]).build();
                SizePlan plan = planner.plan(source[0], source[1], spec, 1);
                CropBox box = plan.getBox().get();
                assertTrue(box + " in " + source[0] + "x" + source[1], box.isWithin(source[0], source[1]));
                assertTrue(plan.getSize().width <= source[0]);
                assertTrue(plan.getSize().height <= source[1]);
            }
        }
    }

    @Test
    public void testFillClampsToSource() {
        RenditionSpec spec = RenditionSpec.builder().resize(ResizeMode.FILL).width(400).height(100).build();
        SizePlan plan = planner.plan(300, 200, spec, 1);
        assertEquals(new RenditionSize(300, 100), plan.getSize());
        assertEquals("0-50-300-150", plan.getBox().get().label());
    }

    @Test
    public void testFillOutputScaleKeepsAspect() {
        RenditionSpec spec = RenditionSpec.builder().resize(ResizeMode.FILL).width(200).height(100).build();
        SizePlan plan = planner.plan(300, 200, spec, 2);
        assertEquals(new RenditionSize(300, 150), plan.getSize());
        assertEquals("0-25-300-175", plan.getBox().get().label());
    }

    @Test
    public void testStretch() {
        RenditionSpec spec = RenditionSpec.builder().resize(ResizeMode.STRETCH).width(300).height(100).build();
        SizePlan plan = planner.plan(2000, 1000, spec, 1);
        assertEquals(new RenditionSize(300, 100), plan.getSize());
        assertFalse(plan.getBox().isPresent());
    }

    @Test
    public void testStretchMayExceedSource() {
        RenditionSpec spec = RenditionSpec.builder().resize(ResizeMode.STRETCH).width(300).height(100).build();
        assertEquals(new RenditionSize(400, 100), planner.plan(200, 50, spec, 2).getSize());
    }

    @Test
    public void testCropBecomesBox() {
        RenditionSpec spec = RenditionSpec.builder().crop(CropRect.parse("100,100,400,200")).build();
        SizePlan plan = planner.plan(2000, 1000, spec, 1);
        assertEquals(new RenditionSize(400, 200), plan.getSize());
        assertEquals("100-100-500-300", plan.getBox().get().label());
    }

    @Test
    public void testCropIsClippedToSource() {
        RenditionSpec spec = RenditionSpec.builder().crop(CropRect.parse("1800,900,400,400")).build();
        SizePlan plan = planner.plan(2000, 1000, spec, 1);
        assertEquals(new RenditionSize(200, 100), plan.getSize());
        assertEquals("1800-900-2000-1000", plan.getBox().get().label());
    }

    @Test
    public void testFillInsideCrop() {
        RenditionSpec spec = RenditionSpec.builder()
                .crop(CropRect.parse("100,0,1000,500"))
                .resize(ResizeMode.FILL).width(100).height(100)
                .build();
        SizePlan plan = planner.plan(2000, 1000, spec, 1);
        assertEquals(new RenditionSize(100, 100), plan.getSize());
        assertEquals("350-0-850-500", plan.getBox().get().label());
    }

    @Test(expected = InvalidSpecException.class)
    public void testCropOutsideSource() {
        planner.plan(200, 100, RenditionSpec.builder().crop(CropRect.parse("300,0,10,10")).build(), 1);
    }

    @Test
    public void testTinyResultsClampToOnePixel() {
        RenditionSpec spec = RenditionSpec.builder().width(1).build();
        assertEquals(new RenditionSize(1, 1), planner.plan(2000, 10, spec, 1).getSize());
    }

    @Test(expected = InvalidSpecException.class)
    public void testStretchBeyondIntRangeIsRejected() {
        RenditionSpec spec = RenditionSpec.builder().resize(ResizeMode.STRETCH).scaleMinWidth(1500000000).build();
        planner.plan(400, 200, spec, 2);
    }
}
