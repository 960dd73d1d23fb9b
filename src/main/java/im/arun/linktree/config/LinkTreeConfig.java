package im.arun.linktree.config;

import lombok.Data;

@Data
public class LinkTreeConfig {
    private int indentUnit = 4;
    private String pathSeparator = "/";
    private String tagDelimiter = ",";
    private BindingMode bindingMode = BindingMode.KEYWORD;
    private String defaultTag = "";
}
