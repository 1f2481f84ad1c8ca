package com.retailops.backend;

import com.retailops.auth.Role;
import com.retailops.backend.dto.*;

/**
 * Typed proxy for the RetailCore endpoints the gateway uses.
 *
 * <p>All methods block (bounded by the configured timeouts) and throw {@link BackendException}
 * classified as BACKEND_UNAVAILABLE, BACKEND_TIMEOUT, BACKEND_REJECTED or BACKEND_AMBIGUOUS.
 * Writes are sent with {@code confirm=true}: the gateway has already run the preview/confirm
 * handshake.</p>
 */
public interface RetailCoreClient {

    InventoryAvailability lookupInventory(InventoryQuery query, Role role);

    Reservation reserveItem(ReserveItemCommand command, Role role, String idempotencyKey);

    Transfer createTransfer(TransferCommand command, Role role, String idempotencyKey);

    Ticket createTicket(TicketCommand command, Role role, String idempotencyKey);
}
