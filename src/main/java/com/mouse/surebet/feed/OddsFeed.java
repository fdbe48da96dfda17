package com.mouse.surebet.feed;

import com.mouse.surebet.exception.TransientFetchException;
import com.mouse.surebet.model.OddsQuery;
import com.mouse.surebet.model.OddsRow;

import java.util.List;

/**
 * Source of raw quote rows. The only step of a cycle that may block or fail.
 */
public interface OddsFeed {

    String name();

    /**
     * @throws TransientFetchException when the store cannot be read right now
     */
    List<OddsRow> fetch(OddsQuery query);
}
