package work.labsim.simulator.engine;

import work.labsim.simulator.runtime.NamingStyle;

public enum EngineGeneration {
    LEGACY(NamingStyle.LEGACY),
    CURRENT(NamingStyle.CURRENT);

    private final NamingStyle namingStyle;

    EngineGeneration(NamingStyle namingStyle) {
        this.namingStyle = namingStyle;
    }

    public NamingStyle namingStyle() {
        return namingStyle;
    }
}
