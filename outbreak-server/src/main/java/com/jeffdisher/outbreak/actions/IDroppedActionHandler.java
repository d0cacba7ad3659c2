package com.jeffdisher.outbreak.actions;

import com.jeffdisher.outbreak.persistence.TransientStoreException;


/**
 * Called by the clock when a due PendingAction was taken from the queue but never successfully handled (the store
 * refused to consume it or its handler failed).  The action will not be delivered again so whatever state was waiting
 * on it must be released or given a new action.
 * Like handlers, this must treat an action which no longer matches the world as a no-op.
 */
public interface IDroppedActionHandler
{
	void dropped(PendingAction action, long nowMillis) throws TransientStoreException;
}
