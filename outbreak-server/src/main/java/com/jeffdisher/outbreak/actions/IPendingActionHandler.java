package com.jeffdisher.outbreak.actions;

import com.jeffdisher.outbreak.persistence.TransientStoreException;


/**
 * Resumes processing of a PendingAction which has come due.  By the time this is called, the action has already been
 * removed from the queue and the store so it will never be delivered again.
 * Handlers must treat actions which no longer match the world (the entity is gone or was re-scheduled) as no-ops.
 */
public interface IPendingActionHandler
{
	void handle(PendingAction action, long nowMillis) throws TransientStoreException;
}
