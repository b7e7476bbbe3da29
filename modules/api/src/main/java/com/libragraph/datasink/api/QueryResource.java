package com.libragraph.datasink.api;

import com.libragraph.datasink.api.dto.QueryRequest;
import com.libragraph.datasink.api.dto.QueryResponse;
import com.libragraph.datasink.core.engine.CatalogService;
import com.libragraph.datasink.core.error.ValidationException;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;

@Path("/query")
@Consumes(MediaType.APPLICATION_JSON)
@Produces(MediaType.APPLICATION_JSON)
public class QueryResource {

    @Inject
    CatalogService catalogService;

    /** Query over dataset content, or over catalog metadata when {@code meta_data} is set. */
    @POST
    public QueryResponse query(QueryRequest request) {
        return QueryResponse.from(catalogService.engine().query(requireQuery(request), request.metaData()));
    }

    @POST
    @Path("/{collection}/{dataset}")
    public QueryResponse queryDataset(@PathParam("collection") String collection,
                                      @PathParam("dataset") String dataset,
                                      QueryRequest request) {
        return QueryResponse.from(catalogService.engine().queryDataset(collection, dataset, requireQuery(request)));
    }

    private static String requireQuery(QueryRequest request) {
        if (request == null) {
            throw new ValidationException("Request body with a query is required");
        }
        return request.query();
    }
}
