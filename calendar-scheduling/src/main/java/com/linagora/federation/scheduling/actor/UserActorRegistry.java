/********************************************************************
 *  As a subpart of Twake Mail, this file is edited by Linagora.    *
 *                                                                  *
 *  https://twake-mail.com/                                         *
 *  https://linagora.com                                            *
 *                                                                  *
 *  This file is subject to The Affero Gnu Public License           *
 *  version 3.                                                      *
 *                                                                  *
 *  https://www.gnu.org/licenses/agpl-3.0.en.html                   *
 *                                                                  *
 *  This program is distributed in the hope that it will be         *
 *  useful, but WITHOUT ANY WARRANTY; without even the implied      *
 *  warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR         *
 *  PURPOSE. See the GNU Affero General Public License for          *
 *  more details.                                                   *
 ********************************************************************/

package com.linagora.federation.scheduling.actor;

import java.io.Closeable;
import java.time.Duration;

import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;

import org.apache.james.core.Username;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Ticker;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.cache.RemovalListener;

/**
 * Routes each user to its single {@link UserActor}.
 *
 * <p>Actors left idle for {@code idleTimeout} are evicted and retired once their queue is drained. The idle
 * timeout must stay well above the longest operation a user can submit.
 */
public class UserActorRegistry implements Closeable {
    public static final Duration DEFAULT_IDLE_TIMEOUT = Duration.ofMinutes(10);

    private final LoadingCache<Username, UserActor> actors;

    @Inject
    public UserActorRegistry() {
        this(DEFAULT_IDLE_TIMEOUT, Ticker.systemTicker());
    }

    @VisibleForTesting
    UserActorRegistry(Duration idleTimeout, Ticker ticker) {
        RemovalListener<Username, UserActor> retireOnEviction = notification -> notification.getValue().retire();
        this.actors = CacheBuilder.newBuilder()
            .expireAfterAccess(idleTimeout)
            .ticker(ticker)
            .removalListener(retireOnEviction)
            .build(CacheLoader.from(UserActor::new));
    }

    public UserActor forUser(Username username) {
        return actors.getUnchecked(username);
    }

    public long size() {
        actors.cleanUp();
        return actors.size();
    }

    @PreDestroy
    @Override
    public void close() {
        actors.asMap().values().forEach(UserActor::dispose);
        actors.invalidateAll();
    }
}
