/**********************************************************************
Copyright (c) 2014 Andy Jefferson and others. All rights reserved.
Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.

Contributors:
    ...
 **********************************************************************/
package org.schemasync.cassandra.connection;

import java.net.InetSocketAddress;
import java.util.ArrayList;
import java.util.List;
import java.util.StringTokenizer;

import org.datanucleus.exceptions.NucleusUserException;
import org.datanucleus.util.Localiser;
import org.datanucleus.util.NucleusLogger;
import org.datanucleus.util.StringUtils;
import org.schemasync.cassandra.SchemaSyncConfiguration;

import com.datastax.oss.driver.api.core.CqlSession;
import com.datastax.oss.driver.api.core.CqlSessionBuilder;

/**
 * Connection factory for Cassandra clusters. Accepts a URL of the form
 * <pre>
 * cassandra:[host1:port[,host2[,host3]]]
 * </pre>
 *
 * Defaults to the driver default contact point (127.0.0.1:9042) if no host/port specified.
 * Defaults to a single CqlSession shared by all connections, but can be overridden using
 * "schemasync.cassandra.sessionPerConnection".
 */
public class ConnectionFactory
{
    public static final String URL_PREFIX = "cassandra";

    public static final int DEFAULT_PORT = 9042;

    static
    {
        Localiser.registerBundle(SchemaSyncConfiguration.LOCALISATION_BUNDLE, ConnectionFactory.class.getClassLoader());
    }

    boolean sessionPerConnection = false;

    CqlSessionBuilder sessionBuilder = null;

    /** CqlSession used when we have a single CqlSession for all connections. */
    CqlSession session = null;

    /** Whether the shared session was provided by the caller, so is not ours to close. */
    boolean externalSession = false;

    /**
     * Constructor for a factory creating its session(s) from the configuration.
     * @param conf The configuration
     */
    public ConnectionFactory(SchemaSyncConfiguration conf)
    {
        String url = conf.getConnectionURL();
        if (url == null)
        {
            throw new NucleusUserException(Localiser.msg("SchemaSync.Config.MissingURL", SchemaSyncConfiguration.PROPERTY_CONNECTION_URL));
        }
        List<InetSocketAddress> contactPoints = getContactPoints(url);

        sessionBuilder = CqlSession.builder();
        if (!contactPoints.isEmpty())
        {
            NucleusLogger.CONNECTION.debug("Starting Cassandra CqlSessionBuilder for hosts " + StringUtils.collectionToString(contactPoints));
            for (InetSocketAddress addr : contactPoints)
            {
                sessionBuilder.addContactPoint(addr);
            }
        }
        else
        {
            // Fallback to Cassandra default (localhost:9042) - no need to add a contact point
            NucleusLogger.CONNECTION.debug("Starting Cassandra CqlSessionBuilder with default contact point(s)");
        }

        String localDC = conf.getLocalDatacenter();
        if (!StringUtils.isWhitespace(localDC))
        {
            sessionBuilder.withLocalDatacenter(localDC);
        }

        // Add any login credentials
        String user = conf.getConnectionUserName();
        String passwd = conf.getConnectionPassword();
        if (!StringUtils.isWhitespace(user))
        {
            sessionBuilder.withAuthCredentials(user, passwd != null ? passwd : "");
        }

        sessionPerConnection = conf.isSessionPerConnection();
    }

    /**
     * Constructor for a factory that hands out connections for an existing session. The session is not closed by
     * this factory.
     * @param session The session
     */
    public ConnectionFactory(CqlSession session)
    {
        this.session = session;
        this.externalSession = true;
    }

    /**
     * Extract the contact points from a connection URL of the form "cassandra:[host1[:port][,host2[:port]...]]".
     * @param url The URL
     * @return The contact points (empty when no hosts are specified)
     * @throws NucleusUserException if the URL does not start with "cassandra" followed by ":" or nothing
     */
    public static List<InetSocketAddress> getContactPoints(String url)
    {
        String trimmed = url.trim();
        if (!trimmed.startsWith(URL_PREFIX))
        {
            throw new NucleusUserException(Localiser.msg("SchemaSync.Config.InvalidURL", url));
        }
        String remains = trimmed.substring(URL_PREFIX.length()).trim();
        if (remains.length() > 0)
        {
            if (remains.charAt(0) != ':')
            {
                throw new NucleusUserException(Localiser.msg("SchemaSync.Config.InvalidURL", url));
            }
            remains = remains.substring(1); // Strip ":"
        }

        List<InetSocketAddress> addresses = new ArrayList<>();
        StringTokenizer tokeniser = new StringTokenizer(remains, ",");
        while (tokeniser.hasMoreTokens())
        {
            String token = tokeniser.nextToken().trim();
            if (StringUtils.isWhitespace(token))
            {
                continue;
            }

            String hostStr = token;
            int portNumber = DEFAULT_PORT;
            int nextColon = token.indexOf(':');
            if (nextColon > 0)
            {
                hostStr = token.substring(0, nextColon).trim();
                String portStr = token.substring(nextColon + 1).trim();
                try
                {
                    portNumber = Integer.parseInt(portStr);
                }
                catch (NumberFormatException nfe)
                {
                    NucleusLogger.CONNECTION.warn("Unable to convert '" + portStr + "' to port number for Cassandra, so using " + DEFAULT_PORT);
                }
            }
            addresses.add(new InetSocketAddress(hostStr, portNumber));
        }
        return addresses;
    }

    /**
     * Obtain a connection. The caller must release it once finished.
     * @return The connection
     */
    public ManagedSession getConnection()
    {
        if (sessionPerConnection)
        {
            ManagedSession mconn = new ManagedSession(sessionBuilder.build(), true);
            NucleusLogger.CONNECTION.debug("ManagedSession " + mconn.toString() + " - obtained CqlSession");
            return mconn;
        }

        if (session == null)
        {
            session = sessionBuilder.build();
        }
        ManagedSession mconn = new ManagedSession(session, false);
        NucleusLogger.CONNECTION.debug("ManagedSession " + mconn.toString() + " - using connection");
        return mconn;
    }

    public void close()
    {
        if (session != null && !externalSession)
        {
            NucleusLogger.CONNECTION.debug("Closed Cassandra CqlSession");
            session.close();
        }
        session = null;
    }
}
