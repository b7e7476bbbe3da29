package com.libragraph.datasink.api;

import com.libragraph.datasink.api.dto.CollectionCreated;
import com.libragraph.datasink.api.dto.CollectionItem;
import com.libragraph.datasink.api.dto.DatasetCreated;
import com.libragraph.datasink.api.dto.DatasetItem;
import com.libragraph.datasink.api.dto.ItemsResponse;
import com.libragraph.datasink.core.catalog.CatalogRecord;
import com.libragraph.datasink.core.catalog.DatasetRecord;
import com.libragraph.datasink.core.engine.CatalogService;
import com.libragraph.datasink.core.engine.DatasetContent;
import com.libragraph.datasink.core.error.ValidationException;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.PUT;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import java.io.IOException;
import java.nio.file.Files;

/**
 * Collections and datasets addressed by title: {@code /data/{collection}/{dataset}}.
 */
@Path("/data")
@Produces(MediaType.APPLICATION_JSON)
public class DataResource {

    @Inject
    CatalogService catalogService;

    @GET
    public ItemsResponse<CollectionItem> listCollections() {
        return new ItemsResponse<>(catalogService.engine().listCollections().stream()
                .map(CollectionItem::from)
                .toList());
    }

    @PUT
    @Consumes({MediaType.APPLICATION_FORM_URLENCODED, MediaType.MULTIPART_FORM_DATA})
    public Response createCollection(@RestForm("collection_name") String collectionName,
                                     @RestForm("sub_collection_id") String subCollectionId) {
        CatalogRecord created = catalogService.engine().createCollection(collectionName, emptyToNull(subCollectionId));
        return Response.status(Response.Status.CREATED)
                .entity(new CollectionCreated(created.id(), created.modified()))
                .build();
    }

    @GET
    @Path("/{collection}")
    public ItemsResponse<DatasetItem> listDatasets(@PathParam("collection") String collection) {
        return new ItemsResponse<>(catalogService.engine().listDatasets(collection).stream()
                .map(DatasetItem::from)
                .toList());
    }

    /**
     * Deletes the collection, or only the nested collection named by {@code sub_collection_id}.
     */
    @DELETE
    @Path("/{collection}")
    public Response deleteCollection(@PathParam("collection") String collection,
                                     @QueryParam("sub_collection_id") String subCollectionId) {
        catalogService.engine().deleteCatalog(collection, emptyToNull(subCollectionId));
        return Response.noContent().build();
    }

    @PUT
    @Path("/{collection}")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public Response createDataset(@PathParam("collection") String collection,
                                  @RestForm("dataset_name") String datasetName,
                                  @RestForm("sub_collection_id") String subCollectionId,
                                  @RestForm("file") FileUpload file) throws IOException {
        DatasetRecord created = catalogService.engine()
                .createDataset(collection, datasetName, emptyToNull(subCollectionId), read(file));
        return Response.status(Response.Status.CREATED)
                .entity(toCreated(created))
                .build();
    }

    @GET
    @Path("/{collection}/{dataset}")
    @Produces(MediaType.APPLICATION_OCTET_STREAM)
    public Response getDataset(@PathParam("collection") String collection,
                               @PathParam("dataset") String dataset) {
        DatasetContent content = catalogService.engine().getDataset(collection, dataset);
        return Response.ok(content.data(), MediaType.APPLICATION_OCTET_STREAM)
                .header("Content-Disposition", "attachment; filename=\"" + dataset + "\"")
                .header("ETag", "\"" + content.hash().toHex() + "\"")
                .build();
    }

    @POST
    @Path("/{collection}/{dataset}")
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public DatasetCreated updateDataset(@PathParam("collection") String collection,
                                        @PathParam("dataset") String dataset,
                                        @RestForm("file") FileUpload file) throws IOException {
        return toCreated(catalogService.engine().updateDataset(collection, dataset, read(file)));
    }

    @DELETE
    @Path("/{collection}/{dataset}")
    public Response deleteDataset(@PathParam("collection") String collection,
                                  @PathParam("dataset") String dataset) {
        catalogService.engine().deleteDataset(collection, dataset);
        return Response.noContent().build();
    }

    private static DatasetCreated toCreated(DatasetRecord record) {
        return new DatasetCreated(record.id(), record.distribution().format().tag(),
                record.distribution().downloadUrl(), record.modified());
    }

    private static byte[] read(FileUpload file) throws IOException {
        if (file == null) {
            throw new ValidationException("A file part is required");
        }
        return Files.readAllBytes(file.uploadedFile());
    }

    private static String emptyToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
