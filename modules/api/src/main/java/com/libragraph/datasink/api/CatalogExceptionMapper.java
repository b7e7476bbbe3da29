package com.libragraph.datasink.api;

import com.libragraph.datasink.core.error.CatalogException;
import com.libragraph.datasink.core.error.ConflictException;
import com.libragraph.datasink.core.error.IntegrityException;
import com.libragraph.datasink.core.error.NotFoundException;
import com.libragraph.datasink.core.error.ValidationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.Map;

/**
 * Maps the catalog error taxonomy to status codes with a {@code {"detail": ...}} body.
 * Messages of non client-facing errors are replaced by a generic text.
 */
@Provider
public class CatalogExceptionMapper implements ExceptionMapper<CatalogException> {

    private static final Logger log = Logger.getLogger(CatalogExceptionMapper.class);

    @Override
    public Response toResponse(CatalogException e) {
        Response.Status status = statusOf(e);
        String detail;
        if (e.isClientFacing()) {
            detail = e.getMessage();
        } else if (e instanceof IntegrityException) {
            log.errorf("Inconsistent stored data: %s", e.getMessage());
            detail = "Stored data is inconsistent";
        } else {
            detail = "Internal storage error";
        }
        return Response.status(status)
                .type(MediaType.APPLICATION_JSON)
                .entity(Map.of("detail", detail))
                .build();
    }

    static Response.Status statusOf(CatalogException e) {
        if (e instanceof NotFoundException) {
            return Response.Status.NOT_FOUND;
        }
        if (e instanceof ConflictException) {
            return Response.Status.CONFLICT;
        }
        if (e instanceof ValidationException) {
            return Response.Status.BAD_REQUEST;
        }
        return Response.Status.INTERNAL_SERVER_ERROR;
    }
}
