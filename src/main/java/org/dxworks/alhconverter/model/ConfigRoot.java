package org.dxworks.alhconverter.model;

/**
 * Root of a freshly built tree. Its tag is the configuration name.
 */
public final class ConfigRoot extends TreeNode {

    ConfigRoot(String configName) {
        super(configName, configName, SortKey.of(0));
    }
}
