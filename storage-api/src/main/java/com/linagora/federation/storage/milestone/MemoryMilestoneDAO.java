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

package com.linagora.federation.storage.milestone;

import org.apache.james.core.Username;

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Table;
import com.google.common.collect.Tables;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

public class MemoryMilestoneDAO implements MilestoneDAO {

    private final Table<Username, MilestoneId, Milestone> store = Tables.synchronizedTable(HashBasedTable.create());

    @Override
    public Flux<Milestone> list(Username username) {
        return Flux.defer(() -> {
            synchronized (store) {
                return Flux.fromIterable(ImmutableList.copyOf(store.row(username).values()));
            }
        });
    }

    @Override
    public Mono<Void> add(Username username, Milestone milestone) {
        return Mono.fromRunnable(() -> store.put(username, milestone.id(), milestone));
    }

    @Override
    public Mono<Void> remove(Username username, MilestoneId milestoneId) {
        return Mono.fromRunnable(() -> store.remove(username, milestoneId));
    }
}
