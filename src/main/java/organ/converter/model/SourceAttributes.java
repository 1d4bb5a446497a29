package organ.converter.model;

import static organ.converter.model.SourceTypes.CONTINUOUS_CONTROL;
import static organ.converter.model.SourceTypes.CONTINUOUS_CONTROL_LINKAGE;
import static organ.converter.model.SourceTypes.DISPLAY_PAGE;
import static organ.converter.model.SourceTypes.ENCLOSURE;
import static organ.converter.model.SourceTypes.GENERAL;
import static organ.converter.model.SourceTypes.IMAGE_SET;
import static organ.converter.model.SourceTypes.IMAGE_SET_ELEMENT;
import static organ.converter.model.SourceTypes.IMAGE_SET_INSTANCE;
import static organ.converter.model.SourceTypes.KEYBOARD;
import static organ.converter.model.SourceTypes.KEYBOARD_KEY;
import static organ.converter.model.SourceTypes.KEY_ACTION;
import static organ.converter.model.SourceTypes.KEY_IMAGE_SET;
import static organ.converter.model.SourceTypes.PIPE;
import static organ.converter.model.SourceTypes.PIPE_LAYER;
import static organ.converter.model.SourceTypes.RANK;
import static organ.converter.model.SourceTypes.RELEASE_SAMPLE;
import static organ.converter.model.SourceTypes.SAMPLE;
import static organ.converter.model.SourceTypes.STOP;
import static organ.converter.model.SourceTypes.STOP_RANK;
import static organ.converter.model.SourceTypes.SWITCH;
import static organ.converter.model.SourceTypes.SWITCH_LINKAGE;
import static organ.converter.model.SourceTypes.TEXT_INSTANCE;
import static organ.converter.model.SourceTypes.TEXT_STYLE;
import static organ.converter.model.SourceTypes.WIND_COMPARTMENT;

/**
 * Every source attribute the synthesizer and resolver read, with its requirement and default.
 * Reads go through {@link AttributeReader}.
 */
public final class SourceAttributes {

    private SourceAttributes() {
    }

    // _General
    public static final AttrSpec ORGAN_NAME = AttrSpec.requiredText(GENERAL, "Identification_Name");
    public static final AttrSpec ORGAN_LOCATION = AttrSpec.text(GENERAL, "Identification_Location", "");
    public static final AttrSpec ORGAN_BUILDER = AttrSpec.text(GENERAL, "Identification_OrganBuilder");
    public static final AttrSpec ORGAN_BUILD_DATE = AttrSpec.text(GENERAL, "Identification_BuildDate");
    public static final AttrSpec ORGAN_COMMENTS = AttrSpec.text(GENERAL, "Identification_Comments");
    public static final AttrSpec ORGAN_RECORDING_DETAILS = AttrSpec.text(GENERAL, "Identification_RecordingDetails");
    public static final AttrSpec ORGAN_INFO_FILENAME = AttrSpec.text(GENERAL, "Identification_InfoFilename");
    public static final AttrSpec CONSOLE_WIDTH = AttrSpec.integer(GENERAL, "Display_ConsoleScreenWidthPixels");
    public static final AttrSpec CONSOLE_HEIGHT = AttrSpec.integer(GENERAL, "Display_ConsoleScreenHeightPixels");

    public static final AttrSpec PAGE_NAME = AttrSpec.text(DISPLAY_PAGE, "Name");

    // keyboards
    public static final AttrSpec KEYBOARD_NAME = AttrSpec.text(KEYBOARD, "Name");
    public static final AttrSpec KEYBOARD_KEY_COUNT = AttrSpec.integer(KEYBOARD, "KeyGen_NumberOfKeys");
    public static final AttrSpec KEYBOARD_FIRST_NOTE = AttrSpec.integer(KEYBOARD, "KeyGen_MIDINoteNumberOfFirstKey");
    public static final AttrSpec KEYBOARD_LEFT = AttrSpec.integer(KEYBOARD, "KeyGen_DispKeyboardLeftXPos", 0);
    public static final AttrSpec KEYBOARD_TOP = AttrSpec.integer(KEYBOARD, "KeyGen_DispKeyboardTopYPos", 0);
    public static final AttrSpec KEYBOARD_ASSIGNMENT_CODE = AttrSpec.integer(KEYBOARD, "DefaultInputOutputKeyboardAsgnCode", 0);
    public static final AttrSpec KEY_NOTE = AttrSpec.requiredInteger(KEYBOARD_KEY, "NormalMIDINoteNumber");

    public static final AttrSpec KEY_SHAPE_CF = AttrSpec.reference(KEY_IMAGE_SET, "KeyShapeImageSetID_CF");
    public static final AttrSpec KEY_SHAPE_D = AttrSpec.reference(KEY_IMAGE_SET, "KeyShapeImageSetID_D");
    public static final AttrSpec KEY_SHAPE_EB = AttrSpec.reference(KEY_IMAGE_SET, "KeyShapeImageSetID_EB");
    public static final AttrSpec KEY_SHAPE_G = AttrSpec.reference(KEY_IMAGE_SET, "KeyShapeImageSetID_G");
    public static final AttrSpec KEY_SHAPE_A = AttrSpec.reference(KEY_IMAGE_SET, "KeyShapeImageSetID_A");
    public static final AttrSpec KEY_SHAPE_SHARP = AttrSpec.reference(KEY_IMAGE_SET, "KeyShapeImageSetID_Sharp");
    public static final AttrSpec KEY_IMAGE_INDEX_ENGAGED = AttrSpec.integer(KEY_IMAGE_SET, "ImageIndexWithinImageSets_Engaged", 2);
    public static final AttrSpec KEY_IMAGE_INDEX_DISENGAGED = AttrSpec.integer(KEY_IMAGE_SET, "ImageIndexWithinImageSets_Disengaged", 1);
    public static final AttrSpec KEY_NATURAL_SPACING = AttrSpec.integer(KEY_IMAGE_SET, "HorizSpacingPixels_NaturalToNatural");
    public static final AttrSpec KEY_SHARP_OFFSET = AttrSpec.integer(KEY_IMAGE_SET, "HorizSpacingPixels_SharpOffsetFromNatural");

    // key actions
    public static final AttrSpec KEY_ACTION_DEST_KEYBOARD = AttrSpec.reference(KEY_ACTION, "DestKeyboardID");
    public static final AttrSpec KEY_ACTION_DEST_DIVISION = AttrSpec.reference(KEY_ACTION, "DestDivisionID");
    public static final AttrSpec KEY_ACTION_CONDITION_SWITCH = AttrSpec.reference(KEY_ACTION, "ConditionSwitchID");
    public static final AttrSpec KEY_ACTION_NOTE_INCREMENT = AttrSpec.integer(KEY_ACTION, "MIDINoteNumIncrementFromSourceToDest", 0);
    public static final AttrSpec KEY_ACTION_TYPE = AttrSpec.integer(KEY_ACTION, "ActionTypeCode", 1);
    public static final AttrSpec KEY_ACTION_FIRST_NOTE = AttrSpec.integer(KEY_ACTION, "FirstMIDINoteNumToAffect");
    public static final AttrSpec KEY_ACTION_KEY_COUNT = AttrSpec.integer(KEY_ACTION, "NumberOfKeysToAffect");

    // switches
    public static final AttrSpec SWITCH_NAME = AttrSpec.text(SWITCH, "Name");
    public static final AttrSpec SWITCH_DEFAULT_ENGAGED = AttrSpec.flag(SWITCH, "DefaultToEngaged", false);
    public static final AttrSpec SWITCH_CLICKABLE = AttrSpec.flag(SWITCH, "Clickable", false);
    public static final AttrSpec SWITCH_IMAGE_INDEX_ENGAGED = AttrSpec.integer(SWITCH, "Disp_ImageSetIndexEngaged", 2);
    public static final AttrSpec SWITCH_IMAGE_INDEX_DISENGAGED = AttrSpec.integer(SWITCH, "Disp_ImageSetIndexDisengaged", 1);

    public static final AttrSpec LINK_SOURCE_SWITCH = AttrSpec.reference(SWITCH_LINKAGE, "SourceSwitchID");
    public static final AttrSpec LINK_DEST_SWITCH = AttrSpec.reference(SWITCH_LINKAGE, "DestSwitchID");
    public static final AttrSpec LINK_CONDITION_SWITCH = AttrSpec.reference(SWITCH_LINKAGE, "ConditionSwitchID");
    public static final AttrSpec LINK_ENGAGE_ACTION = AttrSpec.integer(SWITCH_LINKAGE, "EngageLinkActionCode");
    public static final AttrSpec LINK_DISENGAGE_ACTION = AttrSpec.integer(SWITCH_LINKAGE, "DisengageLinkActionCode");
    public static final AttrSpec LINK_SOURCE_IF_ENGAGED = AttrSpec.flag(SWITCH_LINKAGE, "SourceSwitchLinkIfEngaged", true);

    // stops and ranks
    public static final AttrSpec STOP_NAME = AttrSpec.text(STOP, "Name");
    public static final AttrSpec STOP_RANK_ACTION_TYPE = AttrSpec.integer(STOP_RANK, "ActionTypeCode", 1);
    public static final AttrSpec STOP_RANK_FIRST_NOTE = AttrSpec.integer(STOP_RANK, "MIDINoteNumOfFirstMappedDivisionInputNode");
    public static final AttrSpec STOP_RANK_NODE_COUNT = AttrSpec.integer(STOP_RANK, "NumberOfMappedDivisionInputNodes");
    public static final AttrSpec STOP_RANK_NOTE_INCREMENT = AttrSpec.integer(STOP_RANK, "MIDINoteNumIncrementFromDivisionToRank", 0);
    public static final AttrSpec STOP_RANK_LAYER = AttrSpec.integer(STOP_RANK, "PipeLayerNumber", 1);
    public static final AttrSpec STOP_RANK_RANK = AttrSpec.reference(STOP_RANK, "RankID");
    public static final AttrSpec RANK_NAME = AttrSpec.text(RANK, "Name");

    public static final AttrSpec PIPE_NOTE = AttrSpec.requiredInteger(PIPE, "NormalMIDINoteNumber");
    public static final AttrSpec LAYER_NUMBER = AttrSpec.integer(PIPE_LAYER, "PipeLayerNumber", 1);
    public static final AttrSpec LAYER_GAIN = AttrSpec.decimal(PIPE_LAYER, "AmpLvl_LevelAdjustDecibels");
    public static final AttrSpec RELEASE_MAX_KEY_TIME = AttrSpec.integer(RELEASE_SAMPLE, "ReleaseSelCriteria_LatestKeyReleaseTimeMs");
    public static final AttrSpec SAMPLE_FILENAME = AttrSpec.requiredText(SAMPLE, "SampleFilename");
    public static final AttrSpec SAMPLE_PACKAGE = AttrSpec.reference(SAMPLE, "InstallationPackageID");

    public static final AttrSpec WIND_COMPARTMENT_NAME = AttrSpec.text(WIND_COMPARTMENT, "Name");

    // continuous controls and enclosures
    public static final AttrSpec CONTROL_NAME = AttrSpec.text(CONTINUOUS_CONTROL, "Name");
    public static final AttrSpec CONTROL_LINK_SOURCE = AttrSpec.reference(CONTINUOUS_CONTROL_LINKAGE, "SourceControlID");
    public static final AttrSpec CONTROL_LINK_DEST = AttrSpec.reference(CONTINUOUS_CONTROL_LINKAGE, "DestControlID");
    public static final AttrSpec ENCLOSURE_NAME = AttrSpec.text(ENCLOSURE, "Name");
    public static final AttrSpec ENCLOSURE_MIN_AMPLITUDE = AttrSpec.integer(ENCLOSURE, "MinimumAmplitudePercent", 1);

    // images and text
    public static final AttrSpec IMAGE_SET_WIDTH = AttrSpec.integer(IMAGE_SET, "ImageWidthPixels");
    public static final AttrSpec IMAGE_SET_HEIGHT = AttrSpec.integer(IMAGE_SET, "ImageHeightPixels");
    public static final AttrSpec IMAGE_SET_PACKAGE = AttrSpec.reference(IMAGE_SET, "InstallationPackageID");
    public static final AttrSpec IMAGE_SET_MASK = AttrSpec.text(IMAGE_SET, "TransparencyMaskBitmapFilename");
    public static final AttrSpec IMAGE_ELEMENT_INDEX = AttrSpec.integer(IMAGE_SET_ELEMENT, "ElementID", 1);
    public static final AttrSpec IMAGE_ELEMENT_BITMAP = AttrSpec.requiredText(IMAGE_SET_ELEMENT, "BitmapFilename");
    public static final AttrSpec INSTANCE_LAYER = AttrSpec.integer(IMAGE_SET_INSTANCE, "ScreenLayerNumber", 0);
    public static final AttrSpec INSTANCE_LEFT = AttrSpec.integer(IMAGE_SET_INSTANCE, "LeftXPosPixels", 0);
    public static final AttrSpec INSTANCE_TOP = AttrSpec.integer(IMAGE_SET_INSTANCE, "TopYPosPixels", 0);
    public static final AttrSpec INSTANCE_RIGHT_IF_TILING = AttrSpec.integer(IMAGE_SET_INSTANCE, "RightXPosPixelsIfTiling");
    public static final AttrSpec INSTANCE_BOTTOM_IF_TILING = AttrSpec.integer(IMAGE_SET_INSTANCE, "BottomYPosPixelsIfTiling");
    public static final AttrSpec INSTANCE_DEFAULT_INDEX = AttrSpec.integer(IMAGE_SET_INSTANCE, "ImageSetIndexDefault", 1);

    public static final AttrSpec FONT_SIZE = AttrSpec.integer(TEXT_STYLE, "Font_SizePixels", 10);
    public static final AttrSpec FONT_NAME = AttrSpec.text(TEXT_STYLE, "Font_Name");
    public static final AttrSpec COLOUR_RED = AttrSpec.integer(TEXT_STYLE, "Colour_Red", 0);
    public static final AttrSpec COLOUR_GREEN = AttrSpec.integer(TEXT_STYLE, "Colour_Green", 0);
    public static final AttrSpec COLOUR_BLUE = AttrSpec.integer(TEXT_STYLE, "Colour_Blue", 0);
    public static final AttrSpec TEXT = AttrSpec.requiredText(TEXT_INSTANCE, "Text");
    public static final AttrSpec TEXT_X = AttrSpec.integer(TEXT_INSTANCE, "XPosPixels", 0);
    public static final AttrSpec TEXT_Y = AttrSpec.integer(TEXT_INSTANCE, "YPosPixels", 0);
    public static final AttrSpec TEXT_BOX_WIDTH = AttrSpec.integer(TEXT_INSTANCE, "BoundingBoxWidthPixelsIfWordWrap");
    public static final AttrSpec TEXT_BOX_HEIGHT = AttrSpec.integer(TEXT_INSTANCE, "BoundingBoxHeightPixelsIfWordWrap");
}
