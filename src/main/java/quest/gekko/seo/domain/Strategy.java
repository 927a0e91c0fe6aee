package quest.gekko.seo.domain;

/** Device profile PageSpeed emulates. */
public enum Strategy {
    MOBILE,
    DESKTOP;

    public String wireValue() {
        return name().toLowerCase();
    }
}
