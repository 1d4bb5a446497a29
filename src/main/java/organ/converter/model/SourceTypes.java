package organ.converter.model;

/**
 * Record type names of the Hauptwerk source schema handled by the converter.
 */
public final class SourceTypes {

    private SourceTypes() {
    }

    public static final String GENERAL = "_General";
    public static final String DISPLAY_PAGE = "DisplayPage";
    public static final String DIVISION = "Division";
    public static final String KEYBOARD = "Keyboard";
    public static final String KEYBOARD_KEY = "KeyboardKey";
    public static final String KEY_IMAGE_SET = "KeyImageSet";
    public static final String KEY_ACTION = "KeyAction";
    public static final String SWITCH = "Switch";
    public static final String SWITCH_LINKAGE = "SwitchLinkage";
    public static final String STOP = "Stop";
    public static final String STOP_RANK = "StopRank";
    public static final String RANK = "Rank";
    public static final String PIPE = "Pipe_SoundEngine01";
    public static final String PIPE_LAYER = "Pipe_SoundEngine01_Layer";
    public static final String ATTACK_SAMPLE = "Pipe_SoundEngine01_AttackSample";
    public static final String RELEASE_SAMPLE = "Pipe_SoundEngine01_ReleaseSample";
    public static final String SAMPLE = "Sample";
    public static final String INSTALLATION_PACKAGE = "InstallationPackage";
    public static final String WIND_COMPARTMENT = "WindCompartment";
    public static final String CONTINUOUS_CONTROL = "ContinuousControl";
    public static final String CONTINUOUS_CONTROL_LINKAGE = "ContinuousControlLinkage";
    public static final String ENCLOSURE = "Enclosure";
    public static final String ENCLOSURE_PIPE = "EnclosurePipe";
    public static final String IMAGE_SET = "ImageSet";
    public static final String IMAGE_SET_ELEMENT = "ImageSetElement";
    public static final String IMAGE_SET_INSTANCE = "ImageSetInstance";
    public static final String TEXT_STYLE = "TextStyle";
    public static final String TEXT_INSTANCE = "TextInstance";
}
