package com.libragraph.sift.api;

import com.libragraph.sift.core.scan.ScanService;
import com.libragraph.sift.formats.api.FormatParser;
import com.libragraph.sift.formats.api.Signature;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.util.HexFormat;
import java.util.List;
import java.util.Map;

@Path("/api/diagnostic")
@Produces(MediaType.APPLICATION_JSON)
public class DiagnosticResource {

    /** One registered variant, in discovery order. */
    public record ParserInfo(String id, int priority, List<String> signatures) {}

    @ConfigProperty(name = "quarkus.application.name")
    String appName;

    @ConfigProperty(name = "quarkus.application.version")
    String appVersion;

    @ConfigProperty(name = "quarkus.profile", defaultValue = "prod")
    String profile;

    @Inject
    ScanService scanService;

    @GET
    @Path("/ping")
    public Map<String, String> ping() {
        return Map.of(
                "status", "ok",
                "message", "Sift is running"
        );
    }

    @GET
    @Path("/info")
    public Map<String, String> info() {
        return Map.of(
                "name", appName,
                "version", appVersion,
                "java", System.getProperty("java.version"),
                "profile", profile
        );
    }

    @GET
    @Path("/parsers")
    public List<ParserInfo> parsers() {
        return scanService.registry().parsers().stream()
                .map(DiagnosticResource::describe)
                .toList();
    }

    private static ParserInfo describe(FormatParser<?> parser) {
        List<String> signatures = parser.signatures().stream()
                .map(DiagnosticResource::format)
                .toList();
        return new ParserInfo(parser.id(), parser.priority(), signatures);
    }

    // "<hex>@<offset>", e.g. "424d@0"
    private static String format(Signature signature) {
        return HexFormat.of().formatHex(signature.pattern()) + "@" + signature.offset();
    }
}
