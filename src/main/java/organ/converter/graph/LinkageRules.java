package organ.converter.graph;

import static organ.converter.graph.LinkageRule.child;
import static organ.converter.graph.LinkageRule.parent;
import static organ.converter.model.SourceTypes.ATTACK_SAMPLE;
import static organ.converter.model.SourceTypes.CONTINUOUS_CONTROL;
import static organ.converter.model.SourceTypes.CONTINUOUS_CONTROL_LINKAGE;
import static organ.converter.model.SourceTypes.DISPLAY_PAGE;
import static organ.converter.model.SourceTypes.DIVISION;
import static organ.converter.model.SourceTypes.ENCLOSURE;
import static organ.converter.model.SourceTypes.ENCLOSURE_PIPE;
import static organ.converter.model.SourceTypes.IMAGE_SET;
import static organ.converter.model.SourceTypes.IMAGE_SET_ELEMENT;
import static organ.converter.model.SourceTypes.IMAGE_SET_INSTANCE;
import static organ.converter.model.SourceTypes.INSTALLATION_PACKAGE;
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

import java.util.List;

/**
 * The ordered linkage tables. Order matters: derived rules read edges created by the plain rules.
 */
public final class LinkageRules {

    private LinkageRules() {
    }

    public static final List<LinkageRule> RULES = List.of(
            parent(KEYBOARD, "KeyGen_DisplayPageID", DISPLAY_PAGE),
            parent(KEYBOARD, "Hint_PrimaryAssociatedDivisionID", DIVISION),
            child(KEYBOARD, "KeyGen_KeyImageSetID", KEY_IMAGE_SET),

            parent(KEYBOARD_KEY, "KeyboardID", KEYBOARD).required(),
            child(KEYBOARD_KEY, "SwitchID", SWITCH),
            child(KEYBOARD_KEY, "Disp_ImageSetInstanceID", IMAGE_SET_INSTANCE),

            child(KEY_IMAGE_SET, "KeyShapeImageSetID_CF", IMAGE_SET),
            child(KEY_IMAGE_SET, "KeyShapeImageSetID_D", IMAGE_SET),
            child(KEY_IMAGE_SET, "KeyShapeImageSetID_EB", IMAGE_SET),
            child(KEY_IMAGE_SET, "KeyShapeImageSetID_G", IMAGE_SET),
            child(KEY_IMAGE_SET, "KeyShapeImageSetID_A", IMAGE_SET),
            child(KEY_IMAGE_SET, "KeyShapeImageSetID_Sharp", IMAGE_SET),
            child(KEY_IMAGE_SET, "KeyShapeImageSetID_WholeNatural", IMAGE_SET),

            parent(KEY_ACTION, "SourceKeyboardID", KEYBOARD).required(),
            child(KEY_ACTION, "DestKeyboardID", KEYBOARD),
            child(KEY_ACTION, "DestDivisionID", DIVISION),
            parent(KEY_ACTION, "ConditionSwitchID", SWITCH),

            child(SWITCH, "Disp_ImageSetInstanceID", IMAGE_SET_INSTANCE),

            parent(SWITCH_LINKAGE, "SourceSwitchID", SWITCH).required(),
            child(SWITCH_LINKAGE, "DestSwitchID", SWITCH).required(),
            parent(SWITCH_LINKAGE, "ConditionSwitchID", SWITCH),

            parent(STOP, "DivisionID", DIVISION).required(),
            parent(STOP, "ControllingSwitchID", SWITCH),

            parent(STOP_RANK, "StopID", STOP).required(),
            child(STOP_RANK, "RankID", RANK).required(),
            child(STOP_RANK, "AlternateRankID", RANK),

            parent(PIPE, "RankID", RANK).required(),
            parent(PIPE, "WindSupply_SourceWindCompartmentID", WIND_COMPARTMENT),
            parent(PIPE, "ControllingPalletSwitchID", SWITCH),

            parent(PIPE_LAYER, "PipeID", PIPE).required(),
            parent(PIPE_LAYER, "AmpLvl_ScalingContinuousControlID", CONTINUOUS_CONTROL),

            parent(ATTACK_SAMPLE, "LayerID", PIPE_LAYER).required(),
            child(ATTACK_SAMPLE, "SampleID", SAMPLE).required(),
            parent(RELEASE_SAMPLE, "LayerID", PIPE_LAYER).required(),
            child(RELEASE_SAMPLE, "SampleID", SAMPLE).required(),
            child(SAMPLE, "InstallationPackageID", INSTALLATION_PACKAGE).required(),

            child(CONTINUOUS_CONTROL, "ImageSetInstanceID", IMAGE_SET_INSTANCE),
            parent(CONTINUOUS_CONTROL_LINKAGE, "SourceControlID", CONTINUOUS_CONTROL),
            child(CONTINUOUS_CONTROL_LINKAGE, "DestControlID", CONTINUOUS_CONTROL),
            parent(CONTINUOUS_CONTROL_LINKAGE, "ConditionSwitchID", SWITCH),

            parent(ENCLOSURE, "ShutterPositionContinuousControlID", CONTINUOUS_CONTROL),
            parent(ENCLOSURE_PIPE, "EnclosureID", ENCLOSURE),
            child(ENCLOSURE_PIPE, "PipeID", PIPE),

            parent(IMAGE_SET_ELEMENT, "ImageSetID", IMAGE_SET).required(),
            child(IMAGE_SET_INSTANCE, "ImageSetID", IMAGE_SET).required(),
            parent(IMAGE_SET_INSTANCE, "DisplayPageID", DISPLAY_PAGE),
            child(IMAGE_SET, "InstallationPackageID", INSTALLATION_PACKAGE),

            parent(TEXT_INSTANCE, "DisplayPageID", DISPLAY_PAGE),
            child(TEXT_INSTANCE, "TextStyleID", TEXT_STYLE),
            parent(TEXT_INSTANCE, "AttachedToImageSetInstanceID", IMAGE_SET_INSTANCE)
    );

    public static final List<DerivedLinkageRule> DERIVED_RULES = List.of(
            new DerivedLinkageRule(SWITCH, IMAGE_SET_INSTANCE, false, DISPLAY_PAGE, false),
            new DerivedLinkageRule(CONTINUOUS_CONTROL, IMAGE_SET_INSTANCE, false, DISPLAY_PAGE, false),
            new DerivedLinkageRule(TEXT_INSTANCE, IMAGE_SET_INSTANCE, true, DISPLAY_PAGE, true)
    );

    /**
     * Types attached to the root record when nothing else parents them.
     */
    public static final List<String> ROOT_ATTACHED_TYPES = List.of(
            DISPLAY_PAGE,
            DIVISION,
            KEYBOARD,
            SWITCH,
            CONTINUOUS_CONTROL,
            RANK,
            WIND_COMPARTMENT,
            INSTALLATION_PACKAGE,
            IMAGE_SET,
            TEXT_STYLE,
            KEY_IMAGE_SET,
            ENCLOSURE
    );
}
