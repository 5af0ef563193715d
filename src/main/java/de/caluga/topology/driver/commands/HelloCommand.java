package de.caluga.topology.driver.commands;

import de.caluga.topology.driver.Doc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * hello handshake / heartbeat. Sent as legacy <code>isMaster</code> with helloOk until the server confirmed
 * that it understands <code>hello</code>.
 */
public class HelloCommand extends AdminMongoCommand<HelloCommand> {
    public static final String DRIVER_NAME = "morphium-topology";
    public static final String DRIVER_VERSION = "1.0";

    private Boolean helloOk = true;
    private Boolean loadBalanced;
    private List<String> compression;
    private transient boolean legacy = true;
    private transient boolean includeClient = true;
    private transient String appName;

    public Boolean getHelloOk() {
        return helloOk;
    }

    public HelloCommand setHelloOk(Boolean helloOk) {
        this.helloOk = helloOk;
        return this;
    }

    public Boolean getLoadBalanced() {
        return loadBalanced;
    }

    public HelloCommand setLoadBalanced(Boolean loadBalanced) {
        this.loadBalanced = loadBalanced;
        return this;
    }

    public List<String> getCompression() {
        return compression;
    }

    public HelloCommand setCompression(List<String> compression) {
        this.compression = compression == null || compression.isEmpty() ? null : new ArrayList<>(compression);
        return this;
    }

    public boolean isLegacy() {
        return legacy;
    }

    public HelloCommand setLegacy(boolean legacy) {
        this.legacy = legacy;
        return this;
    }

    public boolean isIncludeClient() {
        return includeClient;
    }

    /**
     * client metadata is only sent on the connection handshake, not with heartbeats
     */
    public HelloCommand setIncludeClient(boolean includeClient) {
        this.includeClient = includeClient;
        return this;
    }

    public String getAppName() {
        return appName;
    }

    public HelloCommand setAppName(String appName) {
        this.appName = appName;
        return this;
    }

    @Override
    public String getCommandName() {
        return legacy ? "isMaster" : "hello";
    }

    @Override
    public Map<String, Object> asMap() {
        Map<String, Object> ret = super.asMap();

        if (includeClient) {
            Doc client = Doc.of("driver", Doc.of("name", DRIVER_NAME, "version", DRIVER_VERSION),
                                "os", Doc.of("type", System.getProperty("os.name"), "architecture", System.getProperty("os.arch")),
                                "platform", "Java/" + System.getProperty("java.version"));

            if (appName != null) {
                client.put("application", Doc.of("name", appName));
            }

            ret.put("client", client);
        }

        return ret;
    }
}
