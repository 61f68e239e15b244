package com.libragraph.sift.api;

import com.libragraph.sift.core.scan.ScanResult;
import com.libragraph.sift.core.scan.ScanService;
import com.libragraph.sift.util.buffer.RamBuffer;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DefaultValue;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.logging.Logger;

@Path("/api/scan")
public class ScanResource {

    private static final Logger log = Logger.getLogger(ScanResource.class);

    @Inject
    ScanService scanService;

    /**
     * Scans the request body and returns the full result tree.
     * A scan cut short by the configured timeout still answers 200 with status ABORTED.
     */
    @POST
    @Consumes(MediaType.APPLICATION_OCTET_STREAM)
    @Produces(MediaType.APPLICATION_JSON)
    public ScanReport scan(@QueryParam("name") @DefaultValue("upload.bin") String name, byte[] body) {
        if (name.isBlank() || name.contains("/")) {
            throw new WebApplicationException("Invalid name: " + name, Response.Status.BAD_REQUEST);
        }
        byte[] data = body == null ? new byte[0] : body;
        log.debugf("Scan request '%s' (%d bytes)", name, data.length);
        try (RamBuffer buffer = new RamBuffer(data)) {
            ScanResult result = scanService.scan(buffer, name);
            return ScanReport.from(result);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new WebApplicationException("Scan interrupted", Response.Status.SERVICE_UNAVAILABLE);
        } catch (IllegalStateException e) {
            throw new WebApplicationException(e.getMessage(), Response.Status.SERVICE_UNAVAILABLE);
        }
    }
}
