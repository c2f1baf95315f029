/**
 * Package storing the remote side of picoget: querying package indexes for candidate versions
 * and transferring package archives to disk.
 *
 * <p>Both concerns are modelled as interfaces ({@link org.stianloader.picoget.repo.PackageIndex} and
 * {@link org.stianloader.picoget.repo.ArchiveTransport}) so that the resolution and download engine
 * can run against offline mirrors or in-memory fixtures just as well as against nuget.org.
 */
package org.stianloader.picoget.repo;
