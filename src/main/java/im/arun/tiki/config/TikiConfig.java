package im.arun.tiki.config;

import lombok.Data;

@Data
public class TikiConfig {
    private int frontmatterLineLimit = 10;
    private String codeFence = "```";
    private String collapseMarker = "[+]";
    private boolean prettyJson = true;
    private boolean styled = true;
}
