package com.libragraph.datasink.api;

import com.libragraph.datasink.core.catalog.ExportFormat;
import com.libragraph.datasink.core.engine.CatalogService;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.Response;

/**
 * DCAT export of a collection tree or a single dataset. JSON-LD unless
 * {@code ?format=} names another serialization.
 */
@Path("/metadata/dcat")
public class MetadataResource {

    @Inject
    CatalogService catalogService;

    @GET
    @Path("/{collection}")
    public Response collection(@PathParam("collection") String collection,
                               @QueryParam("format") String format) {
        ExportFormat exportFormat = ExportFormat.fromParam(format);
        String document = catalogService.engine().exportCollection(collection, exportFormat);
        return Response.ok(document, exportFormat.mediaType()).build();
    }

    @GET
    @Path("/{collection}/{dataset}")
    public Response dataset(@PathParam("collection") String collection,
                            @PathParam("dataset") String dataset,
                            @QueryParam("format") String format) {
        ExportFormat exportFormat = ExportFormat.fromParam(format);
        String document = catalogService.engine().exportDataset(collection, dataset, exportFormat);
        return Response.ok(document, exportFormat.mediaType()).build();
    }
}
