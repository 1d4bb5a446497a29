package organ.converter.synth;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import organ.converter.HwDocument;
import organ.converter.ProgressListener;
import organ.converter.graph.TargetStore;
import organ.converter.model.ConversionLog;
import organ.converter.model.TargetRecord;
import organ.converter.scan.MediaResolver;

class PanelBuilderTest {

    @TempDir
    Path root;

    private final ConversionLog log = new ConversionLog();

    private TargetStore synthesize(HwDocument doc) throws Exception {
        final TargetStore target = new TargetStore();
        new ObjectSynthesizer(log, ProgressListener.NONE, new MediaResolver(root, false, log), "")
                .synthesize(doc.link(log), target);
        return target;
    }

    private static HwDocument consolePage() {
        return HwDocument.organ("x")
                .add("DisplayPage", "PageID", "1", "Name", "Console")
                .add("ImageSet", "ImageSetID", "1", "Name", "Background", "InstallationPackageID", "1",
                        "ImageWidthPixels", "800", "ImageHeightPixels", "600")
                .add("ImageSetElement", "ImageSetID", "1", "ElementID", "1", "BitmapFilename", "Images\\bg.png")
                .add("ImageSetInstance", "ImageSetInstanceID", "1", "ImageSetID", "1", "DisplayPageID", "1")
                .add("ImageSet", "ImageSetID", "2", "Name", "Knob", "InstallationPackageID", "1",
                        "ImageWidthPixels", "40", "ImageHeightPixels", "44")
                .add("ImageSetElement", "ImageSetID", "2", "ElementID", "1", "BitmapFilename", "Images\\off.png")
                .add("ImageSetElement", "ImageSetID", "2", "ElementID", "2", "BitmapFilename", "Images\\on.png")
                .add("ImageSetInstance", "ImageSetInstanceID", "2", "ImageSetID", "2", "DisplayPageID", "1",
                        "LeftXPosPixels", "100", "TopYPosPixels", "50")
                .add("TextStyle", "TextStyleID", "1", "Font_Name", "Times", "Font_SizePixels", "12",
                        "Colour_Red", "255", "Colour_Green", "0", "Colour_Blue", "0")
                .add("TextInstance", "DisplayPageID", "1", "TextStyleID", "1", "Text", "Great",
                        "XPosPixels", "10", "YPosPixels", "20");
    }

    @Test
    void pageBecomesPanelWithImagesAndLabels() throws Exception {
        final TargetStore target = synthesize(consolePage());

        final TargetRecord panel = target.get("Panel000");
        assertThat(panel.get("Name")).isEqualTo("Console");
        assertThat(panel.get("DispScreenSizeHoriz")).isEqualTo("800");
        assertThat(panel.get("DispScreenSizeVert")).isEqualTo("600");
        assertThat(panel.get("NumberOfImages")).isEqualTo("1");
        assertThat(target.get("Panel000Image001").get("Image")).isEqualTo("OrganInstallationPackages/000001/Images/bg.png");

        final TargetRecord label = target.get("Panel000Element001");
        assertThat(label.get("Type")).isEqualTo("Label");
        assertThat(label.get("Name")).isEqualTo("Great");
        assertThat(label.get("DispXpos")).isEqualTo("10");
        assertThat(label.get("DispLabelFontSize")).isEqualTo("12");
        assertThat(label.get("DispLabelFontName")).isEqualTo("Times");
    }

    @Test
    void drawknobOfAStopIsShownAsSwitchElement() throws Exception {
        final TargetStore target = synthesize(consolePage()
                .add("Division", "DivisionID", "1")
                .keyboard(1, "Great", 36, 61)
                .add("Switch", "SwitchID", "10", "Name", "Flute 4", "Clickable", "Y", "Disp_ImageSetInstanceID", "2")
                .add("Stop", "StopID", "1", "Name", "Flute 4", "DivisionID", "1", "ControllingSwitchID", "10")
                .rank(1, "Flute", 36, 96)
                .add("StopRank", "StopID", "1", "RankID", "1"));

        final TargetRecord element = target.get("Panel000Element002");
        assertThat(element.get("Type")).isEqualTo("Switch");
        assertThat(element.get("Switch")).isEqualTo("001");
        assertThat(element.get("PositionX")).isEqualTo("100");
        assertThat(element.get("ImageOn")).isEqualTo("OrganInstallationPackages/000001/Images/on.png");
        assertThat(element.get("ImageOff")).isEqualTo("OrganInstallationPackages/000001/Images/off.png");
        assertThat(element.get("Width")).isEqualTo("40");
        assertThat(element.get("Height")).isEqualTo("44");
        assertThat(target.get("Panel000").get("NumberOfImages")).isEqualTo("1");
    }

    @Test
    void keyImagesOfEachKeyDrawTheManual() throws Exception {
        final TargetStore target = synthesize(consolePage()
                .add("Division", "DivisionID", "1")
                .keyboard(1, "Great", 36, 61)
                .add("ImageSet", "ImageSetID", "3", "Name", "Key", "InstallationPackageID", "1",
                        "ImageWidthPixels", "20", "ImageHeightPixels", "100")
                .add("ImageSetElement", "ImageSetID", "3", "ElementID", "1", "BitmapFilename", "Keys\\up.png")
                .add("ImageSetElement", "ImageSetID", "3", "ElementID", "2", "BitmapFilename", "Keys\\down.png")
                .add("ImageSetInstance", "ImageSetInstanceID", "3", "ImageSetID", "3", "DisplayPageID", "1",
                        "LeftXPosPixels", "200", "TopYPosPixels", "400")
                .add("ImageSetInstance", "ImageSetInstanceID", "4", "ImageSetID", "3", "DisplayPageID", "1",
                        "LeftXPosPixels", "212", "TopYPosPixels", "395")
                .add("KeyboardKey", "KeyboardID", "1", "NormalMIDINoteNumber", "37", "Disp_ImageSetInstanceID", "4")
                .add("KeyboardKey", "KeyboardID", "1", "NormalMIDINoteNumber", "36", "Disp_ImageSetInstanceID", "3"));

        final TargetRecord manual = target.get("Manual001");
        assertThat(manual.get("Displayed")).isEqualTo("Y");
        assertThat(manual.get("Key001ImageOn")).isEqualTo("OrganInstallationPackages/000001/Keys/down.png");
        assertThat(manual.get("Key001ImageOff")).isEqualTo("OrganInstallationPackages/000001/Keys/up.png");
        assertThat(manual.get("Key001Width")).isEqualTo("12");
        assertThat(manual.get("Key001YOffset")).isEqualTo("5");
        assertThat(manual.get("Key002Width")).isEqualTo("20");
        assertThat(manual.get("Key002YOffset")).isEqualTo("0");

        final TargetRecord element = target.get("Panel000Element002");
        assertThat(element.get("Type")).isEqualTo("Manual");
        assertThat(element.get("Manual")).isEqualTo("001");
        assertThat(element.get("PositionX")).isEqualTo("200");
        assertThat(element.get("PositionY")).isEqualTo("395");
        // key images are not static panel images
        assertThat(target.get("Panel000").get("NumberOfImages")).isEqualTo("1");
    }

    @Test
    void sharedKeyImageSetDrawsTheManualByNoteName() throws Exception {
        final TargetStore target = synthesize(consolePage()
                .add("Division", "DivisionID", "1")
                .add("Keyboard", "KeyboardID", "1", "Name", "Swell", "KeyGen_NumberOfKeys", "61",
                        "KeyGen_MIDINoteNumberOfFirstKey", "36", "Hint_PrimaryAssociatedDivisionID", "1",
                        "KeyGen_DisplayPageID", "1", "KeyGen_KeyImageSetID", "1",
                        "KeyGen_DispKeyboardLeftXPos", "50", "KeyGen_DispKeyboardTopYPos", "300")
                .add("KeyImageSet", "KeyImageSetID", "1", "Name", "Keys",
                        "KeyShapeImageSetID_CF", "4", "KeyShapeImageSetID_Sharp", "5",
                        "HorizSpacingPixels_NaturalToNatural", "20", "HorizSpacingPixels_SharpOffsetFromNatural", "14")
                .add("ImageSet", "ImageSetID", "4", "Name", "Natural", "InstallationPackageID", "1")
                .add("ImageSetElement", "ImageSetID", "4", "ElementID", "1", "BitmapFilename", "Keys\\cf_up.png")
                .add("ImageSetElement", "ImageSetID", "4", "ElementID", "2", "BitmapFilename", "Keys\\cf_down.png")
                .add("ImageSet", "ImageSetID", "5", "Name", "Sharp", "InstallationPackageID", "1")
                .add("ImageSetElement", "ImageSetID", "5", "ElementID", "1", "BitmapFilename", "Keys\\sharp_up.png")
                .add("ImageSetElement", "ImageSetID", "5", "ElementID", "2", "BitmapFilename", "Keys\\sharp_down.png"));

        final TargetRecord manual = target.get("Manual001");
        assertThat(manual.get("Displayed")).isEqualTo("Y");
        assertThat(manual.get("ImageOn_C")).isEqualTo("OrganInstallationPackages/000001/Keys/cf_down.png");
        assertThat(manual.get("ImageOff_F")).isEqualTo("OrganInstallationPackages/000001/Keys/cf_up.png");
        assertThat(manual.get("Width_C")).isEqualTo("20");
        assertThat(manual.get("ImageOn_Fis")).isEqualTo("OrganInstallationPackages/000001/Keys/sharp_down.png");
        assertThat(manual.get("Width_Fis")).isEqualTo("0");
        assertThat(manual.get("Offset_Fis")).isEqualTo("-6");
        assertThat(manual.attributes()).doesNotContainKeys("ImageOn_D", "ImageOn_G");

        final TargetRecord element = target.get("Panel000Element002");
        assertThat(element.get("Type")).isEqualTo("Manual");
        assertThat(element.get("PositionX")).isEqualTo("50");
        assertThat(element.get("PositionY")).isEqualTo("300");
    }

    @Test
    void leftoverPageSwitchJoinsLastSeenDivision() throws Exception {
        final TargetStore target = synthesize(consolePage()
                .add("Division", "DivisionID", "1")
                .keyboard(1, "Great", 36, 61)
                .add("Switch", "SwitchID", "10", "Name", "Flute 4", "Clickable", "Y", "Disp_ImageSetInstanceID", "2")
                .add("Stop", "StopID", "1", "Name", "Flute 4", "DivisionID", "1", "ControllingSwitchID", "10")
                .rank(1, "Flute", 36, 96)
                .add("StopRank", "StopID", "1", "RankID", "1")
                .add("ImageSetInstance", "ImageSetInstanceID", "5", "ImageSetID", "2", "DisplayPageID", "1",
                        "LeftXPosPixels", "300", "TopYPosPixels", "50")
                .add("Switch", "SwitchID", "11", "Name", "Tutti", "Clickable", "Y", "Disp_ImageSetInstanceID", "5"));

        final TargetRecord tutti = target.get("Switch002");
        assertThat(tutti.get("Name")).isEqualTo("Tutti");
        final TargetRecord manual = target.get("Manual001");
        assertThat(manual.get("NumberOfSwitches")).isEqualTo("1");
        assertThat(manual.get("Switch001")).isEqualTo("002");
        assertThat(target.get("Panel000Element003").get("Switch")).isEqualTo("002");
    }

    @Test
    void documentWithoutPagesGetsEmptyDefaultPanel() throws Exception {
        final TargetStore target = synthesize(HwDocument.organ("x"));

        final TargetRecord panel = target.get("Panel000");
        assertThat(panel.get("NumberOfGUIElements")).isEqualTo("0");
        assertThat(panel.get("DispScreenSizeHoriz")).isEqualTo(String.valueOf(Geometry.DEFAULT_PANEL_WIDTH));
        assertThat(target.get("Organ").get("NumberOfPanels")).isEqualTo("0");
    }
}
