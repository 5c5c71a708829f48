package github.sarthakdev143.chat_renderer.model;

public enum SoundKind {
    SEND("send"),
    RECEIVE("receive");

    private final String assetName;

    SoundKind(String assetName) {
        this.assetName = assetName;
    }

    public String assetName() {
        return assetName;
    }
}
