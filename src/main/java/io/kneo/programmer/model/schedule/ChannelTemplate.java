package io.kneo.programmer.model.schedule;

import lombok.Getter;

@Getter
public enum ChannelTemplate {
    NETWORK_TELEVISION("network_television", 30),
    PREMIUM_MOVIE("premium_movie", 15);

    private final String dslName;
    private final int gridMinutes;

    ChannelTemplate(String dslName, int gridMinutes) {
        this.dslName = dslName;
        this.gridMinutes = gridMinutes;
    }

    public int getGridSeconds() {
        return gridMinutes * 60;
    }

    public static boolean isKnown(String dslName) {
        for (ChannelTemplate template : values()) {
            if (template.dslName.equals(dslName)) {
                return true;
            }
        }
        return false;
    }

    public static ChannelTemplate fromDsl(Object value) {
        if (value != null && PREMIUM_MOVIE.dslName.equals(value.toString())) {
            return PREMIUM_MOVIE;
        }
        return NETWORK_TELEVISION;
    }
}
